package com.consullo.atlas.core;

/**
 * Axis-aligned rectangle in some image's pixel space.
 *
 * @param x left column (inclusive)
 * @param y top row (inclusive)
 * @param width width in pixels
 * @param height height in pixels
 * @since 1.0
 */
public record Region(int x, int y, int width, int height) {

  public Region {
    if (x < 0 || y < 0) {
      throw new IllegalArgumentException("x/y must not be negative.");
    }
    if (width <= 0 || height <= 0) {
      throw new IllegalArgumentException("width/height must be positive.");
    }
  }

  /**
   * Whether the other region has the same width and height.
   *
   * @param other region
   * @return true if equal-shaped
   */
  public boolean sameShape(Region other) {
    return other != null && width == other.width && height == other.height;
  }
}
