package com.consullo.atlas.match;

import com.consullo.atlas.core.ImageBuffer;
import com.consullo.atlas.core.Single;
import com.consullo.atlas.core.Tile;
import com.consullo.atlas.core.Tileset;
import java.util.ArrayList;
import java.util.List;

/**
 * Sliding-window search of a single inside a tileset.
 *
 * <p>
 * Every window produced by {@link WindowEnumerator} is scored with {@link MaskedScorer}; windows
 * scoring strictly above the threshold become {@link Tile}s with confidence rescaled from
 * (threshold, 1] to (0, 1]. Overlapping accepted windows are all returned.
 * </p>
 *
 * @since 1.0
 */
public final class MatchSearch implements PairMatcher {

  private final MatchSearchConfig config;
  private final MaskedScorer scorer;

  public MatchSearch(MatchSearchConfig config) {
    this(config, new MaskedScorer());
  }

  public MatchSearch(MatchSearchConfig config, MaskedScorer scorer) {
    if (config == null || scorer == null) {
      throw new IllegalArgumentException("config/scorer must not be null.");
    }
    this.config = config;
    this.scorer = scorer;
  }

  @Override
  public List<Tile> match(Tileset tileset, Single single) {
    if (tileset == null || single == null) {
      throw new IllegalArgumentException("tileset/single must not be null.");
    }
    return search(tileset.buffer(), single.buffer());
  }

  /**
   * Searches raw buffers.
   *
   * @param tileset tileset pixels
   * @param single single pixels
   * @return accepted tiles in enumeration order
   */
  public List<Tile> search(ImageBuffer tileset, ImageBuffer single) {
    int denominator = single.opaquePixelCount();
    List<Tile> out = new ArrayList<>();
    if (denominator == 0) {
      return out;
    }

    double threshold = config.threshold();
    for (WindowPair w : WindowEnumerator.enumerate(tileset, single, config.stride())) {
      double raw = scorer.score(tileset, w.tilesetRegion(), single, w.singleRegion(), denominator);
      if (raw > threshold) {
        out.add(new Tile(w.tilesetRegion(), w.singleRegion(), confidence(raw, threshold)));
      }
    }
    return out;
  }

  static double confidence(double raw, double threshold) {
    return (raw - threshold) / (1.0 - threshold);
  }
}
