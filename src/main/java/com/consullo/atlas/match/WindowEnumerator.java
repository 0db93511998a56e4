package com.consullo.atlas.match;

import com.consullo.atlas.core.ImageBuffer;
import com.consullo.atlas.core.Region;
import java.util.Iterator;
import java.util.NoSuchElementException;

/**
 * Enumerates candidate alignments of a single over a tileset on a fixed grid.
 *
 * <p>
 * Window origins step by {@code stride} in both axes, starting at {@code stride - singleSize}
 * so that windows may begin before the tileset's top-left corner and run past its bottom-right
 * corner. Each window is clipped to the tileset and the same clipping is applied to the single,
 * which keeps both regions the same shape. Rows are the outer loop.
 * </p>
 *
 * <p>
 * The returned {@link Iterable} is lazy and can be iterated any number of times.
 * </p>
 *
 * @since 1.0
 */
public final class WindowEnumerator {

  private WindowEnumerator() {
  }

  /**
   * Returns the candidate windows for one (tileset, single) pair.
   *
   * @param tileset tileset buffer
   * @param single single buffer
   * @param stride grid step, positive
   * @return restartable sequence of window pairs
   */
  public static Iterable<WindowPair> enumerate(ImageBuffer tileset, ImageBuffer single, int stride) {
    if (tileset == null || single == null) {
      throw new IllegalArgumentException("tileset/single must not be null.");
    }
    if (stride <= 0) {
      throw new IllegalArgumentException("stride must be positive.");
    }
    return () -> new WindowIterator(tileset.width(), tileset.height(), single.width(),
        single.height(), stride);
  }

  private static final class WindowIterator implements Iterator<WindowPair> {

    private final int tw;
    private final int th;
    private final int sw;
    private final int sh;
    private final int stride;

    private int j;
    private int i;
    private WindowPair pending;

    WindowIterator(int tw, int th, int sw, int sh, int stride) {
      this.tw = tw;
      this.th = th;
      this.sw = sw;
      this.sh = sh;
      this.stride = stride;
      this.j = stride - sh;
      this.i = stride - sw;
    }

    @Override
    public boolean hasNext() {
      while (pending == null && j < th) {
        if (i >= tw) {
          j += stride;
          i = stride - sw;
          continue;
        }
        pending = clip(j, i);
        i += stride;
      }
      return pending != null;
    }

    @Override
    public WindowPair next() {
      if (!hasNext()) {
        throw new NoSuchElementException();
      }
      WindowPair out = pending;
      pending = null;
      return out;
    }

    private WindowPair clip(int row, int col) {
      int ty0 = Math.max(0, row);
      int ty1 = Math.min(th, row + sh);
      int tx0 = Math.max(0, col);
      int tx1 = Math.min(tw, col + sw);
      int sy0 = Math.max(0, -row);
      int sy1 = Math.min(sh, th - row);
      int sx0 = Math.max(0, -col);
      int sx1 = Math.min(sw, tw - col);

      int h = ty1 - ty0;
      int w = tx1 - tx0;
      if (h <= 0 || w <= 0) {
        return null;
      }
      return new WindowPair(new Region(tx0, ty0, w, h), new Region(sx0, sy0, sx1 - sx0, sy1 - sy0));
    }
  }
}
