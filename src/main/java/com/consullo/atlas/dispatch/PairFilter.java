package com.consullo.atlas.dispatch;

import com.consullo.atlas.core.Single;
import com.consullo.atlas.core.Tileset;

/**
 * Pre-filter deciding whether a (tileset, single) pair is worth searching.
 *
 * <p>Filters are a pure performance optimisation: returning false for a pair that would have
 * matched drops that match from the results. Collection-specific naming knowledge lives here,
 * never in the dispatcher.
 *
 * @since 1.0
 */
@FunctionalInterface
public interface PairFilter {

  /**
   * Returns true if the pair should be searched.
   *
   * @param tileset candidate tileset
   * @param single candidate single
   * @return true to search
   */
  boolean shouldTest(Tileset tileset, Single single);

  /**
   * Filter that keeps every pair.
   *
   * @return accept-all filter
   */
  static PairFilter acceptAll() {
    return (tileset, single) -> true;
  }

  default PairFilter and(PairFilter other) {
    if (other == null) {
      throw new IllegalArgumentException("other must not be null.");
    }
    return (tileset, single) -> shouldTest(tileset, single) && other.shouldTest(tileset, single);
  }
}
