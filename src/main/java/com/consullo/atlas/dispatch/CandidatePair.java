package com.consullo.atlas.dispatch;

import com.consullo.atlas.core.AssetId;
import com.consullo.atlas.core.Single;
import com.consullo.atlas.core.Tileset;

/**
 * A (tileset, single) combination to be searched.
 *
 * @param tileset tileset to search in
 * @param single single to search for
 * @since 1.0
 */
public record CandidatePair(Tileset tileset, Single single) {

  public CandidatePair {
    if (tileset == null || single == null) {
      throw new IllegalArgumentException("tileset/single must not be null.");
    }
  }

  /**
   * Identifier key of this pair; two pairs with the same key describe the same search.
   *
   * @return key
   */
  public Key key() {
    return new Key(tileset.id(), single.id());
  }

  @Override
  public String toString() {
    return "(" + tileset.id() + " " + tileset.source().path() + ", "
        + single.id() + " " + single.source().path() + ")";
  }

  /**
   * Identifier pair.
   *
   * @param tilesetId tileset identifier
   * @param singleId single identifier
   */
  public record Key(AssetId tilesetId, AssetId singleId) {
  }
}
