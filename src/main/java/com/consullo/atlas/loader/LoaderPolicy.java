package com.consullo.atlas.loader;

import com.consullo.atlas.core.AssetKind;
import java.util.Optional;

/**
 * Decides whether a file belongs to a collection, and as what.
 *
 * @since 1.0
 */
@FunctionalInterface
public interface LoaderPolicy {

  /**
   * Classifies a file.
   *
   * @param relativePath path relative to the collection's parent directory, '/' separated
   * @return asset kind, or empty to skip the file
   */
  Optional<AssetKind> classify(String relativePath);
}
