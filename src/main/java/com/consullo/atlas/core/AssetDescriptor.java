package com.consullo.atlas.core;

/**
 * Pixel-less asset (character sheets, animations) that is recorded but never matched.
 *
 * @param id identifier
 * @param kind kind; never {@link AssetKind#SINGLE} or {@link AssetKind#TILESET}
 * @param source path and tags
 * @since 1.0
 */
public record AssetDescriptor(AssetId id, AssetKind kind, AssetSource source) implements Asset {

  public AssetDescriptor {
    if (id == null || kind == null || source == null) {
      throw new IllegalArgumentException("id/kind/source must not be null.");
    }
    if (kind.hasPixels()) {
      throw new IllegalArgumentException(kind + " assets must be loaded with pixels.");
    }
  }
}
