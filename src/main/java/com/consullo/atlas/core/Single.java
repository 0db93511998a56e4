package com.consullo.atlas.core;

import java.util.Collections;
import java.util.Set;
import java.util.SortedSet;
import java.util.TreeSet;
import org.apache.commons.lang3.Validate;

/**
 * A tagged sprite image expected to appear inside one or more tilesets.
 *
 * <p>
 * The pixel buffer is immutable. The tileset association set is mutated only by the
 * dispatcher's coordinating thread and read by consumers after a run completes; the class is
 * not safe for concurrent mutation.
 * </p>
 *
 * @since 1.0
 */
public final class Single implements Asset {

  private final AssetId id;
  private final AssetSource source;
  private final ImageBuffer buffer;
  private final SortedSet<AssetId> tilesets = new TreeSet<>();

  public Single(AssetId id, AssetSource source, ImageBuffer buffer) {
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
    return AssetKind.SINGLE;
  }

  @Override
  public AssetSource source() {
    return source;
  }

  public ImageBuffer buffer() {
    return buffer;
  }

  /**
   * Records that this single was found in the given tileset.
   *
   * @param tilesetId tileset identifier
   */
  public void addTileset(AssetId tilesetId) {
    Validate.notNull(tilesetId, "tilesetId must not be null");
    tilesets.add(tilesetId);
  }

  /**
   * Tilesets this single was matched into, in identifier order.
   *
   * @return unmodifiable view
   */
  public Set<AssetId> tilesets() {
    return Collections.unmodifiableSortedSet(tilesets);
  }

  @Override
  public String toString() {
    return "Single(" + id + ", " + source.path() + ")";
  }
}
