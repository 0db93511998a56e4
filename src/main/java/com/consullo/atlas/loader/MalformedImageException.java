package com.consullo.atlas.loader;

import java.nio.file.Path;

/**
 * An image file could not be turned into a usable pixel buffer.
 *
 * @since 1.0
 */
public class MalformedImageException extends Exception {

  private static final long serialVersionUID = 1L;

  private final transient Path path;

  public MalformedImageException(Path path, String reason, Throwable cause) {
    super(path + ": " + reason, cause);
    this.path = path;
  }

  public Path path() {
    return path;
  }
}
