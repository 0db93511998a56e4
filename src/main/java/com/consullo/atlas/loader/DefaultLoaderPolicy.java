package com.consullo.atlas.loader;

import com.consullo.atlas.core.AssetKind;
import java.util.List;
import java.util.Locale;
import java.util.Optional;

/**
 * Classification rules shared by every collection.
 *
 * <p>
 * Rules are checked in order against the lower-cased path; the first one that applies wins:
 * non-image files, palettes and the 32x32/48x48 duplicates are skipped; animation folders
 * keep only GIFs; anything mentioning characters is a character sheet; anything mentioning
 * singles is a single; everything else is a tileset.
 * </p>
 */
public final class DefaultLoaderPolicy implements LoaderPolicy {

  static final List<String> IMAGE_EXTENSIONS = List.of(".png", ".jpg", ".jpeg", ".bmp", ".gif");

  @Override
  public Optional<AssetKind> classify(String relativePath) {
    if (relativePath == null) {
      return Optional.empty();
    }
    String lower = relativePath.toLowerCase(Locale.ROOT);
    String ext = extension(lower);

    if (!IMAGE_EXTENSIONS.contains(ext)) {
      return Optional.empty();
    }
    if (lower.contains("palette")) {
      return Optional.empty();
    }
    // duplicates of the 16x16 art
    if (lower.contains("32x32") || lower.contains("48x48")) {
      return Optional.empty();
    }
    if (lower.contains("animated") || lower.contains("animation")) {
      // TODO: load animated character sheets once frames can be matched individually
      return ".gif".equals(ext) ? Optional.of(AssetKind.ANIMATION) : Optional.empty();
    }
    if (lower.contains("character")) {
      return Optional.of(AssetKind.CHARACTER);
    }
    if (lower.contains("single")) {
      return Optional.of(AssetKind.SINGLE);
    }
    return Optional.of(AssetKind.TILESET);
  }

  private static String extension(String path) {
    String stem = TagParser.stripExtension(path);
    return stem.length() == path.length() ? "" : path.substring(stem.length());
  }
}
