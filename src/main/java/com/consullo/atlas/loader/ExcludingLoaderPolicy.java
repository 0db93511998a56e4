package com.consullo.atlas.loader;

import com.consullo.atlas.core.AssetKind;
import java.util.List;
import java.util.Locale;
import java.util.Optional;
import java.util.stream.Collectors;
import org.apache.commons.lang3.Validate;

/**
 * Skips paths containing any of a set of fragments, otherwise defers to another policy.
 *
 * @since 1.0
 */
public final class ExcludingLoaderPolicy implements LoaderPolicy {

  private final List<String> excludedFragments;
  private final LoaderPolicy delegate;

  /**
   * Creates the policy.
   *
   * @param excludedFragments case-insensitive path fragments to skip
   * @param delegate policy applied to every other path
   */
  public ExcludingLoaderPolicy(List<String> excludedFragments, LoaderPolicy delegate) {
    Validate.notNull(excludedFragments, "excludedFragments must not be null");
    Validate.noNullElements(excludedFragments, "excludedFragments must not contain null");
    Validate.notNull(delegate, "delegate must not be null");
    this.excludedFragments = excludedFragments.stream()
        .map(f -> f.toLowerCase(Locale.ROOT))
        .collect(Collectors.toUnmodifiableList());
    this.delegate = delegate;
  }

  @Override
  public Optional<AssetKind> classify(String relativePath) {
    if (relativePath == null) {
      return Optional.empty();
    }
    String lower = relativePath.toLowerCase(Locale.ROOT);
    for (String fragment : excludedFragments) {
      if (lower.contains(fragment)) {
        return Optional.empty();
      }
    }
    return delegate.classify(relativePath);
  }
}
