package com.consullo.atlas.core;

import java.awt.image.BufferedImage;
import java.util.Arrays;
import org.apache.commons.lang3.Validate;

/**
 * Immutable decoded raster with four channels (RGB + alpha).
 *
 * <p>
 * Pixels are stored row-major as packed ARGB ints, so two pixels agree in all four
 * channels exactly when their packed values are equal. Sources without an alpha channel
 * are normalised to alpha 255 everywhere.
 * </p>
 *
 * <p>
 * Instances are safe to share between threads without locking.
 * </p>
 *
 * @since 1.0
 */
public final class ImageBuffer {

  /** Alpha value of a fully opaque pixel. */
  public static final int OPAQUE = 255;

  private final int width;
  private final int height;
  private final int[] argb;
  private final int opaquePixelCount;

  private ImageBuffer(int width, int height, int[] argb) {
    this.width = width;
    this.height = height;
    this.argb = argb;
    this.opaquePixelCount = countOpaque(argb);
  }

  /**
   * Creates a buffer from packed ARGB pixels. The array is copied.
   *
   * @param width width in pixels
   * @param height height in pixels
   * @param argb row-major packed ARGB pixels, exactly {@code width * height} entries
   * @return buffer
   */
  public static ImageBuffer of(int width, int height, int[] argb) {
    Validate.isTrue(width > 0, "width must be positive");
    Validate.isTrue(height > 0, "height must be positive");
    Validate.notNull(argb, "argb must not be null");
    Validate.isTrue(argb.length == (long) width * height,
        "pixel count %d does not match %dx%d", argb.length, width, height);
    return new ImageBuffer(width, height, argb.clone());
  }

  /**
   * Copies a decoded {@link BufferedImage}. Opaque-only image types report alpha 255 through
   * {@link BufferedImage#getRGB(int, int, int, int, int[], int, int)}.
   *
   * @param image decoded image
   * @return buffer
   */
  public static ImageBuffer fromBufferedImage(BufferedImage image) {
    Validate.notNull(image, "image must not be null");
    int w = image.getWidth();
    int h = image.getHeight();
    Validate.isTrue(w > 0 && h > 0, "image must have positive dimensions");
    int[] pixels = image.getRGB(0, 0, w, h, null, 0, w);
    if (!image.getColorModel().hasAlpha()) {
      for (int i = 0; i < pixels.length; i++) {
        pixels[i] |= 0xFF000000;
      }
    }
    return new ImageBuffer(w, h, pixels);
  }

  public static Builder builder(int width, int height) {
    return new Builder(width, height);
  }

  public int width() {
    return width;
  }

  public int height() {
    return height;
  }

  /**
   * Returns the packed ARGB value at (x, y).
   *
   * @param x column
   * @param y row
   * @return packed ARGB
   */
  public int argb(int x, int y) {
    if (x < 0 || x >= width || y < 0 || y >= height) {
      throw new IndexOutOfBoundsException("(" + x + ", " + y + ") outside " + width + "x" + height);
    }
    return argb[y * width + x];
  }

  public int alpha(int x, int y) {
    return argb(x, y) >>> 24;
  }

  /**
   * Number of pixels whose alpha equals {@link #OPAQUE}.
   *
   * @return opaque pixel count
   */
  public int opaquePixelCount() {
    return opaquePixelCount;
  }

  /**
   * Whether the region lies entirely inside this buffer.
   *
   * @param region region
   * @return true if contained
   */
  public boolean contains(Region region) {
    return region.x() + region.width() <= width && region.y() + region.height() <= height;
  }

  /**
   * Whether a packed ARGB value has alpha {@link #OPAQUE}.
   *
   * @param argb packed pixel
   * @return true if fully opaque
   */
  public static boolean isOpaque(int argb) {
    return (argb >>> 24) == OPAQUE;
  }

  private static int countOpaque(int[] pixels) {
    int n = 0;
    for (int p : pixels) {
      if (isOpaque(p)) {
        n++;
      }
    }
    return n;
  }

  @Override
  public boolean equals(Object o) {
    if (this == o) {
      return true;
    }
    if (!(o instanceof ImageBuffer)) {
      return false;
    }
    ImageBuffer other = (ImageBuffer) o;
    return width == other.width && height == other.height && Arrays.equals(argb, other.argb);
  }

  @Override
  public int hashCode() {
    return 31 * (31 * width + height) + Arrays.hashCode(argb);
  }

  @Override
  public String toString() {
    return "ImageBuffer[" + width + "x" + height + ", opaque=" + opaquePixelCount + "]";
  }

  /**
   * Mutable pixel builder, mostly useful for synthetic images.
   */
  public static final class Builder {

    private final int width;
    private final int height;
    private final int[] argb;

    private Builder(int width, int height) {
      Validate.isTrue(width > 0, "width must be positive");
      Validate.isTrue(height > 0, "height must be positive");
      this.width = width;
      this.height = height;
      Validate.isTrue((long) width * height <= Integer.MAX_VALUE, "%dx%d is too large", width, height);
      this.argb = new int[width * height];
    }

    public Builder fill(int value) {
      Arrays.fill(argb, value);
      return this;
    }

    public Builder pixel(int x, int y, int value) {
      Validate.isTrue(x >= 0 && x < width, "x out of range: %d", x);
      Validate.isTrue(y >= 0 && y < height, "y out of range: %d", y);
      argb[y * width + x] = value;
      return this;
    }

    /**
     * Copies every pixel of {@code source} into this builder with its top-left at (x, y),
     * clipped to the builder's bounds.
     *
     * @param source pixels to paste
     * @param x destination column
     * @param y destination row
     * @return this builder
     */
    public Builder paste(ImageBuffer source, int x, int y) {
      for (int sy = 0; sy < source.height(); sy++) {
        int ty = y + sy;
        if (ty < 0 || ty >= height) {
          continue;
        }
        for (int sx = 0; sx < source.width(); sx++) {
          int tx = x + sx;
          if (tx < 0 || tx >= width) {
            continue;
          }
          argb[ty * width + tx] = source.argb(sx, sy);
        }
      }
      return this;
    }

    public ImageBuffer build() {
      return new ImageBuffer(width, height, argb.clone());
    }
  }
}
