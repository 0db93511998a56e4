package com.consullo.atlas.core;

import java.util.concurrent.atomic.AtomicLong;

/**
 * Issues monotonically increasing {@link AssetId}s.
 *
 * <p>Owned by whoever loads assets and passed in explicitly; there is no shared global counter.
 *
 * @since 1.0
 */
public final class IdAllocator {

  private final AtomicLong next = new AtomicLong();

  public AssetId next() {
    return new AssetId(next.getAndIncrement());
  }
}
