package com.consullo.atlas.match;

import com.consullo.atlas.core.ImageBuffer;
import com.consullo.atlas.core.Region;

/**
 * Scores how well a tileset window reproduces a single window.
 *
 * <p>
 * Only pixels that are fully opaque in the single take part. A masked pixel agrees when all
 * four channels are byte-identical in both windows; there is no tolerance. The denominator is
 * the opaque pixel count of the whole single, so a window clipped by the tileset's edge can
 * never score higher than the fraction of the single it actually shows.
 * </p>
 *
 * @since 1.0
 */
public final class MaskedScorer {

  /**
   * Scores two equal-shaped windows.
   *
   * @param tileset tileset buffer
   * @param tilesetRegion window inside the tileset
   * @param single single buffer
   * @param singleRegion window inside the single
   * @param denominator opaque pixel count of the whole single
   * @return agreement in [0, 1]; 0 when the denominator is 0
   */
  public double score(ImageBuffer tileset, Region tilesetRegion, ImageBuffer single,
      Region singleRegion, int denominator) {
    if (tileset == null || single == null || tilesetRegion == null || singleRegion == null) {
      throw new IllegalArgumentException("buffers/regions must not be null.");
    }
    if (!tilesetRegion.sameShape(singleRegion)) {
      throw new IllegalArgumentException(
          "window shapes differ: " + tilesetRegion + " vs " + singleRegion);
    }
    if (!tileset.contains(tilesetRegion)) {
      throw new IllegalArgumentException(tilesetRegion + " outside tileset " + tileset);
    }
    if (!single.contains(singleRegion)) {
      throw new IllegalArgumentException(singleRegion + " outside single " + single);
    }
    if (denominator < 0) {
      throw new IllegalArgumentException("denominator must not be negative.");
    }
    if (denominator == 0) {
      return 0.0;
    }

    int agree = 0;
    for (int dy = 0; dy < singleRegion.height(); dy++) {
      int sy = singleRegion.y() + dy;
      int ty = tilesetRegion.y() + dy;
      for (int dx = 0; dx < singleRegion.width(); dx++) {
        int s = single.argb(singleRegion.x() + dx, sy);
        if (ImageBuffer.isOpaque(s) && s == tileset.argb(tilesetRegion.x() + dx, ty)) {
          agree++;
        }
      }
    }
    return (double) agree / denominator;
  }

  /**
   * Scores a whole single against an equal-shaped window buffer, using the single's own opaque
   * count as denominator. Handy when inspecting a suspected match by hand.
   *
   * @param single single buffer
   * @param window buffer of the same size
   * @return agreement in [0, 1]
   */
  public double score(ImageBuffer single, ImageBuffer window) {
    if (single == null || window == null) {
      throw new IllegalArgumentException("single/window must not be null.");
    }
    Region full = new Region(0, 0, single.width(), single.height());
    return score(window, new Region(0, 0, window.width(), window.height()), single, full,
        single.opaquePixelCount());
  }
}
