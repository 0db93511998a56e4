package com.consullo.atlas.demo;

import com.consullo.atlas.core.ImageBuffer;
import com.consullo.atlas.core.SyntheticImages;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import java.nio.file.Files;
import java.nio.file.Path;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import static org.assertj.core.api.Assertions.assertThat;

/**
 * End-to-end run of the command-line driver over generated asset packs.
 *
 * @since 1.0
 */
public class TileAssociationAppTest {

  @TempDir
  Path dist;

  @Test
  @DisplayName("Should write per-collection and merged associations with unique identifiers")
  void main_TwoCollections_WritesJson() throws Exception {
    ImageBuffer crate = SyntheticImages.distinct(16, 16, 1);
    ImageBuffer atlas = ImageBuffer.builder(32, 16)
        .paste(SyntheticImages.distinct(16, 16, 2), 0, 0)
        .paste(crate, 16, 0)
        .build();
    SyntheticImages.writePng(dist.resolve("PackA/Singles/crate.png"), crate);
    SyntheticImages.writePng(dist.resolve("PackA/Tiles/atlas.png"), atlas);
    SyntheticImages.writePng(dist.resolve("PackB/Tiles/forest.png"), SyntheticImages.distinct(32, 32, 3));

    TileAssociationApp.main(new String[] {dist.toString(), "PackA", "PackB"});

    ObjectMapper mapper = new ObjectMapper();
    JsonNode packA = mapper.readTree(dist.resolve("PackA.json").toFile());
    JsonNode packB = mapper.readTree(dist.resolve("PackB.json").toFile());
    JsonNode merged = mapper.readTree(dist.resolve("data.json").toFile());

    assertThat(packA.get("#0").get("path").asText()).isEqualTo("PackA/Singles/crate.png");
    assertThat(packA.get("#0").get("tilesets")).extracting(JsonNode::asText).containsExactly("#1");
    JsonNode tile = packA.get("#1").get("tiles").get("#0").get(0);
    assertThat(tile.get(0)).extracting(JsonNode::asInt).containsExactly(16, 0, 16, 16);
    assertThat(tile.get(2).asDouble()).isEqualTo(1.0);

    assertThat(packB.has("#2")).isTrue();
    assertThat(merged.size()).isEqualTo(3);
    assertThat(Files.exists(dist.resolve("data.json"))).isTrue();
  }
}
