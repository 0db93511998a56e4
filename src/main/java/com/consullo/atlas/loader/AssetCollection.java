package com.consullo.atlas.loader;

import com.consullo.atlas.core.Asset;
import com.consullo.atlas.core.AssetDescriptor;
import com.consullo.atlas.core.Single;
import com.consullo.atlas.core.Tileset;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;

/**
 * Everything loaded from one collection directory.
 *
 * @param name collection directory name
 * @param singles singles in load order
 * @param tilesets tilesets in load order
 * @param others pixel-less assets (characters, animations)
 * @since 1.0
 */
public record AssetCollection(String name, List<Single> singles, List<Tileset> tilesets,
    List<AssetDescriptor> others) {

  public AssetCollection {
    if (name == null) {
      throw new IllegalArgumentException("name must not be null.");
    }
    singles = List.copyOf(singles);
    tilesets = List.copyOf(tilesets);
    others = List.copyOf(others);
  }

  /**
   * Every asset in identifier order.
   *
   * @return assets
   */
  public List<Asset> all() {
    List<Asset> out = new ArrayList<>(singles.size() + tilesets.size() + others.size());
    out.addAll(singles);
    out.addAll(tilesets);
    out.addAll(others);
    out.sort(Comparator.comparing(Asset::id));
    return out;
  }
}
