package com.consullo.atlas.core;

import java.util.List;

/**
 * Where an asset came from and how it was labelled.
 *
 * @param path path relative to the collection's parent directory, '/' separated
 * @param tags descriptive tags derived from the path
 * @since 1.0
 */
public record AssetSource(String path, List<String> tags) {

  public AssetSource {
    if (path == null || path.isBlank()) {
      throw new IllegalArgumentException("path must not be blank.");
    }
    tags = tags == null ? List.of() : List.copyOf(tags);
  }
}
