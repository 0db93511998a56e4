package com.consullo.atlas.loader;

import com.consullo.atlas.core.Single;
import com.consullo.atlas.core.Tileset;
import com.consullo.atlas.dispatch.PairFilter;
import java.util.Arrays;
import java.util.List;
import java.util.Locale;
import org.apache.commons.lang3.Validate;

/**
 * Skips theme-sorter pairs whose theme names disagree.
 *
 * <p>
 * Theme-sorted packs name a tileset file {@code <n>_<Theme...>_<suffix>} and put its singles in
 * a directory {@code <n>_<Theme...>_<suffix>}. The theme is what remains after dropping the
 * first and last underscore-separated token. When both sides carry their markers and the
 * themes differ, the single cannot be in that tileset. Names with fewer than two tokens carry no
 * theme, so the pair is kept.
 * </p>
 *
 * @since 1.0
 */
public final class ThemeSorterPairFilter implements PairFilter {

  private final String tilesetMarker;
  private final String singleMarker;
  private final boolean dropSingleVariant;

  /**
   * Creates the filter.
   *
   * @param tilesetMarker case-insensitive fragment identifying theme-sorted tilesets
   * @param singleMarker case-insensitive fragment identifying theme-sorted singles
   * @param dropSingleVariant if true, the last token of the single's theme is a variant suffix
   * and is ignored
   */
  public ThemeSorterPairFilter(String tilesetMarker, String singleMarker, boolean dropSingleVariant) {
    Validate.notBlank(tilesetMarker, "tilesetMarker must not be blank");
    Validate.notBlank(singleMarker, "singleMarker must not be blank");
    this.tilesetMarker = tilesetMarker.toLowerCase(Locale.ROOT);
    this.singleMarker = singleMarker.toLowerCase(Locale.ROOT);
    this.dropSingleVariant = dropSingleVariant;
  }

  @Override
  public boolean shouldTest(Tileset tileset, Single single) {
    String tilesetPath = tileset.source().path();
    String singlePath = single.source().path();
    if (!tilesetPath.toLowerCase(Locale.ROOT).contains(tilesetMarker)
        || !singlePath.toLowerCase(Locale.ROOT).contains(singleMarker)) {
      return true;
    }

    List<String> singleTheme = theme(parentName(singlePath));
    List<String> tilesetTheme = theme(fileName(tilesetPath));
    if (singleTheme == null || tilesetTheme == null) {
      return true;
    }
    if (dropSingleVariant && !singleTheme.isEmpty()) {
      singleTheme = singleTheme.subList(0, singleTheme.size() - 1);
    }
    return singleTheme.equals(tilesetTheme);
  }

  static List<String> theme(String name) {
    String[] tokens = name.split("_", -1);
    if (tokens.length < 2) {
      return null;
    }
    return Arrays.asList(tokens).subList(1, tokens.length - 1);
  }

  static String fileName(String path) {
    return path.substring(path.lastIndexOf('/') + 1);
  }

  static String parentName(String path) {
    int slash = path.lastIndexOf('/');
    return slash < 0 ? "" : fileName(path.substring(0, slash));
  }
}
