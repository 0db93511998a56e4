package com.consullo.atlas.loader;

import com.consullo.atlas.dispatch.PairFilter;
import java.util.List;
import java.util.Locale;

/**
 * Collection-specific knowledge: which files to load and which pairs can be skipped.
 *
 * @since 1.0
 */
public enum CollectionProfile {

  GENERIC(List.of(), PairFilter.acceptAll()),

  MODERN_INTERIORS(
      List.of(
          "old stuff",            // superseded tilesets
          "black_shadow",         // duplicates of the normal tiles
          "shadowless",           // duplicates of the normal tiles
          "user_interface",
          "home_designs",
          "room_builder_subfiles" // not singles
      ),
      new ThemeSorterPairFilter("theme_sorter", "theme_sorter_singles", false)),

  MODERN_EXTERIORS(
      List.of(
          "old_sorting",          // superseded tilesets
          "complete_singles"      // duplicates of the theme sorter singles
      ),
      new ThemeSorterPairFilter("theme_sorter", "singles", true));

  private final List<String> excludedFragments;
  private final PairFilter pairFilter;

  CollectionProfile(List<String> excludedFragments, PairFilter pairFilter) {
    this.excludedFragments = excludedFragments;
    this.pairFilter = pairFilter;
  }

  public LoaderPolicy loaderPolicy() {
    LoaderPolicy base = new DefaultLoaderPolicy();
    return excludedFragments.isEmpty() ? base : new ExcludingLoaderPolicy(excludedFragments, base);
  }

  public PairFilter pairFilter() {
    return pairFilter;
  }

  /**
   * Picks a profile from a collection's directory name.
   *
   * @param directoryName e.g. {@code Modern_Interiors_v41.3.4}
   * @return matching profile, {@link #GENERIC} if none
   */
  public static CollectionProfile forDirectoryName(String directoryName) {
    if (directoryName == null) {
      return GENERIC;
    }
    String squashed = directoryName.toLowerCase(Locale.ROOT).replace("_", "").replace("-", "");
    if (squashed.contains("moderninteriors")) {
      return MODERN_INTERIORS;
    }
    if (squashed.contains("modernexteriors")) {
      return MODERN_EXTERIORS;
    }
    return GENERIC;
  }
}
