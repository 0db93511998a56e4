package com.consullo.atlas.export;

import com.consullo.atlas.core.Asset;
import com.consullo.atlas.core.AssetId;
import com.consullo.atlas.core.Region;
import com.consullo.atlas.core.Single;
import com.consullo.atlas.core.Tile;
import com.consullo.atlas.core.Tileset;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ArrayNode;
import com.fasterxml.jackson.databind.node.ObjectNode;
import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Collection;
import java.util.List;
import java.util.Map;
import org.apache.commons.lang3.Validate;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Writes loaded assets and their associations as a JSON object keyed by asset identifier.
 *
 * <p>
 * Record layout:
 * </p>
 * <ul>
 * <li>every asset: {@code kind}, {@code path}, {@code tags}</li>
 * <li>singles and tilesets: {@code shape} as {@code [width, height]}</li>
 * <li>singles: {@code tilesets}, the identifiers of the tilesets containing them</li>
 * <li>tilesets: {@code tiles}, single identifier to a list of
 * {@code [[x, y, w, h], [x, y, w, h], confidence]} entries (tileset region first)</li>
 * </ul>
 *
 * @since 1.0
 */
public final class AssociationJsonWriter {

  private static final Logger LOGGER = LoggerFactory.getLogger(AssociationJsonWriter.class);

  private final ObjectMapper mapper;

  public AssociationJsonWriter() {
    this(new ObjectMapper());
  }

  public AssociationJsonWriter(ObjectMapper mapper) {
    Validate.notNull(mapper, "mapper must not be null");
    this.mapper = mapper;
  }

  /**
   * Builds the JSON tree for the given assets, in iteration order.
   *
   * @param assets assets to export
   * @return object keyed by identifier
   */
  public ObjectNode toJson(Collection<? extends Asset> assets) {
    Validate.notNull(assets, "assets must not be null");
    ObjectNode root = mapper.createObjectNode();
    for (Asset asset : assets) {
      root.set(asset.id().toString(), record(asset));
    }
    return root;
  }

  /**
   * Writes a JSON tree to a file, replacing it if present.
   *
   * @param json tree
   * @param file target file
   * @throws IOException if writing fails
   */
  public void write(ObjectNode json, Path file) throws IOException {
    Validate.notNull(json, "json must not be null");
    Validate.notNull(file, "file must not be null");
    Path parent = file.toAbsolutePath().getParent();
    if (parent != null) {
      Files.createDirectories(parent);
    }
    mapper.writeValue(file.toFile(), json);
    LOGGER.info("Saved {} records to {}.", json.size(), file);
  }

  public void write(Collection<? extends Asset> assets, Path file) throws IOException {
    write(toJson(assets), file);
  }

  private ObjectNode record(Asset asset) {
    ObjectNode node = mapper.createObjectNode();
    node.put("kind", asset.kind().label());
    node.put("path", asset.source().path());
    ArrayNode tags = node.putArray("tags");
    asset.source().tags().forEach(tags::add);

    if (asset instanceof Single) {
      Single single = (Single) asset;
      shape(node, single.buffer().width(), single.buffer().height());
      ArrayNode tilesets = node.putArray("tilesets");
      for (AssetId id : single.tilesets()) {
        tilesets.add(id.toString());
      }
    } else if (asset instanceof Tileset) {
      Tileset tileset = (Tileset) asset;
      shape(node, tileset.buffer().width(), tileset.buffer().height());
      ObjectNode tiles = node.putObject("tiles");
      for (Map.Entry<AssetId, List<Tile>> e : tileset.tiles().entrySet()) {
        ArrayNode list = tiles.putArray(e.getKey().toString());
        for (Tile tile : e.getValue()) {
          ArrayNode entry = list.addArray();
          region(entry.addArray(), tile.tilesetRegion());
          region(entry.addArray(), tile.singleRegion());
          entry.add(tile.confidence());
        }
      }
    }
    return node;
  }

  private static void shape(ObjectNode node, int width, int height) {
    node.putArray("shape").add(width).add(height);
  }

  private static void region(ArrayNode out, Region r) {
    out.add(r.x()).add(r.y()).add(r.width()).add(r.height());
  }
}
