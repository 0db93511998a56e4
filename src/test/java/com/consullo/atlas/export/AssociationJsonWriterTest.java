package com.consullo.atlas.export;

import com.consullo.atlas.core.AssetDescriptor;
import com.consullo.atlas.core.AssetKind;
import com.consullo.atlas.core.AssetSource;
import com.consullo.atlas.core.IdAllocator;
import com.consullo.atlas.core.Region;
import com.consullo.atlas.core.Single;
import com.consullo.atlas.core.SyntheticImages;
import com.consullo.atlas.core.Tile;
import com.consullo.atlas.core.Tileset;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ObjectNode;
import java.nio.file.Path;
import java.util.List;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import static org.assertj.core.api.Assertions.assertThat;

/**
 * Tests for {@link AssociationJsonWriter}.
 *
 * @since 1.0
 */
public class AssociationJsonWriterTest {

  @TempDir
  Path dir;

  private final IdAllocator ids = new IdAllocator();
  private final Single crate = new Single(ids.next(),
      new AssetSource("Pack/Singles/crate.png", List.of("crate", "pack", "singles")),
      SyntheticImages.distinct(16, 16, 1));
  private final Tileset atlas = new Tileset(ids.next(),
      new AssetSource("Pack/atlas.png", List.of("atlas", "pack", "tilesets")),
      SyntheticImages.distinct(32, 16, 2));
  private final AssetDescriptor bob = new AssetDescriptor(ids.next(), AssetKind.CHARACTER,
      new AssetSource("Pack/Characters/bob.png", List.of("bob", "characters")));

  @Test
  @DisplayName("Should export kinds, shapes and both sides of every association")
  void toJson_Associations_RecordLayout() {
    crate.addTileset(atlas.id());
    atlas.addTile(crate.id(), new Tile(new Region(16, 0, 16, 16), new Region(0, 0, 16, 16), 1.0));

    ObjectNode json = new AssociationJsonWriter().toJson(List.of(crate, atlas, bob));

    assertThat(json.fieldNames()).toIterable().containsExactly("#0", "#1", "#2");

    JsonNode single = json.get("#0");
    assertThat(single.get("kind").asText()).isEqualTo("single");
    assertThat(single.get("path").asText()).isEqualTo("Pack/Singles/crate.png");
    assertThat(single.get("tags")).extracting(JsonNode::asText).containsExactly("crate", "pack", "singles");
    assertThat(single.get("shape")).extracting(JsonNode::asInt).containsExactly(16, 16);
    assertThat(single.get("tilesets")).extracting(JsonNode::asText).containsExactly("#1");

    JsonNode tile = json.get("#1").get("tiles").get("#0").get(0);
    assertThat(json.get("#1").get("kind").asText()).isEqualTo("tileset");
    assertThat(json.get("#1").get("shape")).extracting(JsonNode::asInt).containsExactly(32, 16);
    assertThat(tile.get(0)).extracting(JsonNode::asInt).containsExactly(16, 0, 16, 16);
    assertThat(tile.get(1)).extracting(JsonNode::asInt).containsExactly(0, 0, 16, 16);
    assertThat(tile.get(2).asDouble()).isEqualTo(1.0);

    JsonNode character = json.get("#2");
    assertThat(character.get("kind").asText()).isEqualTo("character");
    assertThat(character.has("shape")).isFalse();
  }

  @Test
  @DisplayName("Should write a file that reads back to the same tree")
  void write_File_RoundTrips() throws Exception {
    AssociationJsonWriter writer = new AssociationJsonWriter();
    Path file = dir.resolve("out/Pack.json");

    writer.write(List.of(crate, atlas), file);

    JsonNode read = new ObjectMapper().readTree(file.toFile());
    assertThat(read).isEqualTo(writer.toJson(List.of(crate, atlas)));
    assertThat(read.get("#0").get("tilesets")).isEmpty();
    assertThat(read.get("#1").get("tiles").size()).isZero();
  }
}
