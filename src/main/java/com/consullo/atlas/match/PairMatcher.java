package com.consullo.atlas.match;

import com.consullo.atlas.core.Single;
import com.consullo.atlas.core.Tile;
import com.consullo.atlas.core.Tileset;
import java.util.List;

/**
 * Finds the accepted matches of one single inside one tileset.
 *
 * <p>Implementations must be pure with respect to their inputs and safe to call from many
 * threads at once.
 *
 * @since 1.0
 */
@FunctionalInterface
public interface PairMatcher {

  /**
   * Returns every accepted tile for the pair.
   *
   * @param tileset tileset to search in
   * @param single single to search for
   * @return accepted tiles, possibly empty, never null
   */
  List<Tile> match(Tileset tileset, Single single);
}
