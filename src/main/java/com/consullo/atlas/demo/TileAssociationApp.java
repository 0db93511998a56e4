package com.consullo.atlas.demo;

import com.consullo.atlas.core.IdAllocator;
import com.consullo.atlas.dispatch.CandidatePair;
import com.consullo.atlas.dispatch.CandidatePairs;
import com.consullo.atlas.dispatch.DispatchListener;
import com.consullo.atlas.dispatch.DispatchSummary;
import com.consullo.atlas.dispatch.DispatcherConfig;
import com.consullo.atlas.dispatch.ParallelDispatcher;
import com.consullo.atlas.export.AssociationJsonWriter;
import com.consullo.atlas.loader.AssetCollection;
import com.consullo.atlas.loader.AssetLoader;
import com.consullo.atlas.loader.CollectionProfile;
import com.consullo.atlas.match.MatchSearch;
import com.consullo.atlas.match.MatchSearchConfig;
import com.fasterxml.jackson.databind.node.ObjectNode;
import java.nio.file.Path;
import java.util.List;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Command-line driver: rebuilds single/tileset associations for one or more asset packs.
 *
 * <p>
 * Usage: {@code TileAssociationApp <distDir> <collectionDir>...}. Each collection directory is
 * resolved against {@code distDir}, loaded with the profile its name suggests, searched, and
 * written to {@code <distDir>/<collectionDir>.json}. All collections are merged into
 * {@code <distDir>/data.json}. Identifiers are unique across collections.
 * </p>
 *
 * @since 1.0
 */
public final class TileAssociationApp {

  private static final Logger LOGGER = LoggerFactory.getLogger(TileAssociationApp.class);

  private TileAssociationApp() {
  }

  /**
   * Entry point.
   *
   * @param args distribution directory followed by collection directory names
   * @throws Exception if loading, matching or writing fails
   */
  public static void main(final String[] args) throws Exception {
    if (args.length < 2) {
      System.err.println("usage: TileAssociationApp <distDir> <collectionDir>...");
      System.exit(2);
      return;
    }

    final Path dist = Path.of(args[0]).toAbsolutePath().normalize();
    final IdAllocator ids = new IdAllocator();
    final AssociationJsonWriter writer = new AssociationJsonWriter();
    final MatchSearch search = new MatchSearch(MatchSearchConfig.defaults());
    final ObjectNode merged = writer.toJson(List.of());

    for (int i = 1; i < args.length; i++) {
      final String name = args[i];
      final CollectionProfile profile = CollectionProfile.forDirectoryName(name);
      LOGGER.info("Processing {} with profile {}", name, profile);

      final AssetCollection collection =
          new AssetLoader(profile.loaderPolicy(), ids).load(dist.resolve(name));
      final List<CandidatePair> pairs =
          CandidatePairs.crossProduct(collection.tilesets(), collection.singles(), profile.pairFilter());

      final ParallelDispatcher dispatcher =
          new ParallelDispatcher(DispatcherConfig.defaults(), search, progressLogger());
      final DispatchSummary summary = dispatcher.run(pairs);
      LOGGER.info("{}: {} pairs searched, {} matched, {} tiles", name, summary.pairsSearched(),
          summary.pairsMatched(), summary.matchCount());

      final ObjectNode json = writer.toJson(collection.all());
      writer.write(json, dist.resolve(name + ".json"));
      merged.setAll(json);
    }

    writer.write(merged, dist.resolve("data.json"));
  }

  private static DispatchListener progressLogger() {
    return (pair, tileCount, completed, total) -> {
      int step = Math.max(1, total / 20);
      if (completed % step == 0 || completed == total) {
        LOGGER.info("Searched {}/{} pairs", completed, total);
      }
    };
  }
}
