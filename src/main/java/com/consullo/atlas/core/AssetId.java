package com.consullo.atlas.core;

/**
 * Stable process-lifetime identifier of a loaded asset.
 *
 * <p>Ordering follows allocation order, which keeps aggregated collections stable regardless of
 * the order in which worker results arrive.
 *
 * @param value allocated sequence number
 * @since 1.0
 */
public record AssetId(long value) implements Comparable<AssetId> {

  public AssetId {
    if (value < 0) {
      throw new IllegalArgumentException("value must not be negative.");
    }
  }

  @Override
  public int compareTo(AssetId other) {
    return Long.compare(value, other.value);
  }

  @Override
  public String toString() {
    return "#" + value;
  }
}
