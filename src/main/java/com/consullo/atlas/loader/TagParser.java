package com.consullo.atlas.loader;

import com.consullo.atlas.core.AssetKind;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Locale;
import java.util.Set;

/**
 * Derives descriptive tags from an asset's relative path.
 *
 * <p>
 * The path is lower-cased, its extension dropped and every run of characters outside
 * {@code [a-z0-9]} treated as a separator. The list starts with the plural kind label, gains
 * every new word longer than two characters that is neither numeric nor pack boilerplate, and
 * is reversed at the end so the file name's words come first.
 * </p>
 *
 * @since 1.0
 */
public final class TagParser {

  static final Set<String> EXCLUDED_WORDS = Set.of(
      "modernexteriors",
      "moderninteriors",
      "modern",
      "sorter",
      "complete",
      "animated",
      "animation",
      "single",
      "tileset",
      "character",
      "gifs",
      "16x16",
      "32x32",
      "48x48",
      "and",
      "the",
      "win");

  private TagParser() {
  }

  /**
   * Parses tags.
   *
   * @param path relative path, '/' separated
   * @param kind asset kind
   * @return tags, most specific first
   */
  public static List<String> parse(String path, AssetKind kind) {
    if (path == null || kind == null) {
      throw new IllegalArgumentException("path/kind must not be null.");
    }
    String stem = stripExtension(path).toLowerCase(Locale.ROOT);

    List<String> unique = new ArrayList<>();
    unique.add(kind.label() + "s");
    for (String word : words(stem)) {
      if (word.length() > 2
          && !isDigits(word)
          && !unique.contains(word)
          && !EXCLUDED_WORDS.contains(word)) {
        unique.add(word);
      }
    }
    Collections.reverse(unique);
    return unique;
  }

  static String stripExtension(String path) {
    int slash = path.lastIndexOf('/');
    int dot = path.lastIndexOf('.');
    // A leading dot names a hidden file, not an extension.
    if (dot <= slash + 1) {
      return path;
    }
    int nameStart = slash + 1;
    boolean allDots = true;
    for (int i = nameStart; i < dot; i++) {
      if (path.charAt(i) != '.') {
        allDots = false;
        break;
      }
    }
    return allDots ? path : path.substring(0, dot);
  }

  private static List<String> words(String s) {
    List<String> out = new ArrayList<>();
    StringBuilder current = new StringBuilder();
    for (int i = 0; i < s.length(); i++) {
      char c = s.charAt(i);
      if ((c >= 'a' && c <= 'z') || (c >= '0' && c <= '9')) {
        current.append(c);
      } else if (current.length() > 0) {
        out.add(current.toString());
        current.setLength(0);
      }
    }
    if (current.length() > 0) {
      out.add(current.toString());
    }
    return out;
  }

  private static boolean isDigits(String s) {
    for (int i = 0; i < s.length(); i++) {
      char c = s.charAt(i);
      if (c < '0' || c > '9') {
        return false;
      }
    }
    return !s.isEmpty();
  }
}
