package com.consullo.atlas.match;

import com.consullo.atlas.core.Region;

/**
 * One candidate alignment: the same window expressed in tileset and single coordinates.
 *
 * @param tilesetRegion window in the tileset
 * @param singleRegion window in the single
 * @since 1.0
 */
public record WindowPair(Region tilesetRegion, Region singleRegion) {

  public WindowPair {
    if (tilesetRegion == null || singleRegion == null) {
      throw new IllegalArgumentException("tilesetRegion/singleRegion must not be null.");
    }
    if (!tilesetRegion.sameShape(singleRegion)) {
      throw new IllegalArgumentException(
          "region shapes differ: " + tilesetRegion + " vs " + singleRegion);
    }
  }
}
