package com.consullo.atlas.core;

/**
 * One accepted match of a single inside a tileset.
 *
 * <p>Both regions describe the same physical window, seen from each buffer's origin, so they
 * always have the same width and height. Confidence is 0 at the acceptance threshold and 1 for
 * a perfect match; 0 itself is never accepted.
 *
 * @param tilesetRegion window in tileset coordinates
 * @param singleRegion window in single coordinates
 * @param confidence normalised confidence in (0, 1]
 * @since 1.0
 */
public record Tile(Region tilesetRegion, Region singleRegion, double confidence) {

  public Tile {
    if (tilesetRegion == null || singleRegion == null) {
      throw new IllegalArgumentException("tilesetRegion/singleRegion must not be null.");
    }
    if (!tilesetRegion.sameShape(singleRegion)) {
      throw new IllegalArgumentException(
          "region shapes differ: " + tilesetRegion + " vs " + singleRegion);
    }
    if (!(confidence > 0.0 && confidence <= 1.0)) {
      throw new IllegalArgumentException("confidence must be in (0, 1]: " + confidence);
    }
  }
}
