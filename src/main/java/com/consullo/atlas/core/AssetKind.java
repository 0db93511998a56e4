package com.consullo.atlas.core;

import java.util.Locale;

/**
 * Kind of asset found in a collection. Only {@link #SINGLE} and {@link #TILESET} carry pixels
 * that take part in matching.
 *
 * @since 1.0
 */
public enum AssetKind {
  SINGLE,
  TILESET,
  CHARACTER,
  ANIMATION;

  /**
   * Lower-case name used in tags and exported records.
   *
   * @return label
   */
  public String label() {
    return name().toLowerCase(Locale.ROOT);
  }

  public boolean hasPixels() {
    return this == SINGLE || this == TILESET;
  }
}
