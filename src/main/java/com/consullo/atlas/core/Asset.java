package com.consullo.atlas.core;

/**
 * Anything a collection loader produces.
 *
 * @since 1.0
 */
public interface Asset {

  AssetId id();

  AssetKind kind();

  AssetSource source();
}
