package com.consullo.atlas.dispatch;

import com.consullo.atlas.core.AssetId;

/**
 * A dispatcher run was aborted before every pair was searched.
 *
 * <p>Carries the identifiers of the pair whose search failed, when known.
 *
 * @since 1.0
 */
public class MatchRunException extends Exception {

  private static final long serialVersionUID = 1L;

  private final AssetId tilesetId;
  private final AssetId singleId;

  public MatchRunException(String message, AssetId tilesetId, AssetId singleId, Throwable cause) {
    super(message, cause);
    this.tilesetId = tilesetId;
    this.singleId = singleId;
  }

  /**
   * Tileset of the failing pair.
   *
   * @return identifier, or null if the failure was not tied to a pair
   */
  public AssetId tilesetId() {
    return tilesetId;
  }

  /**
   * Single of the failing pair.
   *
   * @return identifier, or null if the failure was not tied to a pair
   */
  public AssetId singleId() {
    return singleId;
  }
}
