package com.consullo.atlas.core;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Map;
import java.util.SortedMap;
import java.util.TreeMap;
import org.apache.commons.lang3.Validate;

/**
 * A tagged atlas image that may contain many singles at unknown offsets.
 *
 * <p>
 * Holds, per single, the tiles accepted for that single in this tileset. Like {@link Single},
 * the tile map is written only by the dispatcher's coordinating thread.
 * </p>
 *
 * @since 1.0
 */
public final class Tileset implements Asset {

  private final AssetId id;
  private final AssetSource source;
  private final ImageBuffer buffer;
  private final SortedMap<AssetId, List<Tile>> tiles = new TreeMap<>();

  public Tileset(AssetId id, AssetSource source, ImageBuffer buffer) {
    Validate.notNull(id, "id must not be null");
    Validate.notNull(source, "source must not be null");
    Validate.notNull(buffer, "buffer must not be null");
    this.id = id;
    this.source = source;
    this.buffer = buffer;
  }

  @Override
  public AssetId id() {
    return id;
  }

  @Override
  public AssetKind kind() {
    return AssetKind.TILESET;
  }

  @Override
  public AssetSource source() {
    return source;
  }

  public ImageBuffer buffer() {
    return buffer;
  }

  /**
   * Appends a tile found for the given single.
   *
   * @param singleId single identifier
   * @param tile accepted tile
   */
  public void addTile(AssetId singleId, Tile tile) {
    Validate.notNull(singleId, "singleId must not be null");
    Validate.notNull(tile, "tile must not be null");
    tiles.computeIfAbsent(singleId, k -> new ArrayList<>()).add(tile);
  }

  /**
   * Tiles found for one single, in the order they were appended.
   *
   * @param singleId single identifier
   * @return unmodifiable list, empty if none
   */
  public List<Tile> tilesFor(AssetId singleId) {
    List<Tile> list = tiles.get(singleId);
    return list == null ? List.of() : Collections.unmodifiableList(list);
  }

  /**
   * All tiles keyed by single identifier, in identifier order.
   *
   * @return unmodifiable snapshot
   */
  public Map<AssetId, List<Tile>> tiles() {
    SortedMap<AssetId, List<Tile>> copy = new TreeMap<>();
    for (Map.Entry<AssetId, List<Tile>> e : tiles.entrySet()) {
      copy.put(e.getKey(), List.copyOf(e.getValue()));
    }
    return Collections.unmodifiableSortedMap(copy);
  }

  @Override
  public String toString() {
    return "Tileset(" + id + ", " + source.path() + ")";
  }
}
