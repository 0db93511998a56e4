package com.consullo.atlas.dispatch;

import com.consullo.atlas.core.Single;
import com.consullo.atlas.core.Tileset;
import java.util.ArrayList;
import java.util.Collection;
import java.util.List;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Builds the candidate pair list fed to the {@link ParallelDispatcher}.
 *
 * @since 1.0
 */
public final class CandidatePairs {

  private static final Logger LOGGER = LoggerFactory.getLogger(CandidatePairs.class);

  private CandidatePairs() {
  }

  /**
   * Enumerates tilesets x singles, keeping the pairs accepted by the filter.
   *
   * @param tilesets tilesets
   * @param singles singles
   * @param filter pre-filter
   * @return candidate pairs, tileset-major
   */
  public static List<CandidatePair> crossProduct(Collection<Tileset> tilesets,
      Collection<Single> singles, PairFilter filter) {
    if (tilesets == null || singles == null || filter == null) {
      throw new IllegalArgumentException("tilesets/singles/filter must not be null.");
    }
    List<CandidatePair> out = new ArrayList<>();
    long skipped = 0;
    for (Tileset tileset : tilesets) {
      for (Single single : singles) {
        if (filter.shouldTest(tileset, single)) {
          out.add(new CandidatePair(tileset, single));
        } else {
          skipped++;
        }
      }
    }
    LOGGER.debug("crossProduct: {} candidate pairs, {} skipped by filter", out.size(), skipped);
    return out;
  }
}
