package com.consullo.atlas.match;

import com.consullo.atlas.core.IdAllocator;
import com.consullo.atlas.core.ImageBuffer;
import com.consullo.atlas.core.Region;
import com.consullo.atlas.core.SyntheticImages;
import com.consullo.atlas.core.Tile;
import java.util.List;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.assertj.core.api.Assertions.within;

/**
 * Tests for {@link MatchSearch}.
 *
 * @since 1.0
 */
public class MatchSearchTest {

  private final MatchSearch search = new MatchSearch(MatchSearchConfig.defaults());

  @Test
  @DisplayName("Should find an exact copy at its grid offset with full confidence")
  void search_ExactCopy_OneTile() {
    ImageBuffer single = SyntheticImages.distinct(16, 16, 1);
    ImageBuffer tileset = ImageBuffer.builder(32, 16)
        .paste(SyntheticImages.distinct(16, 16, 2), 0, 0)
        .paste(single, 16, 0)
        .build();

    List<Tile> tiles = search.search(tileset, single);

    assertThat(tiles).containsExactly(
        new Tile(new Region(16, 0, 16, 16), new Region(0, 0, 16, 16), 1.0));
  }

  @Test
  @DisplayName("Should reject a copy with just over 10% of its opaque pixels altered")
  void search_TwentySixPixelsAltered_NoTiles() {
    ImageBuffer single = SyntheticImages.distinct(16, 16, 1);
    ImageBuffer tileset = copyWithAlteredPixels(single, 26);

    // 230 / 256 is below the threshold
    assertThat(search.search(tileset, single)).isEmpty();
  }

  @Test
  @DisplayName("Should accept a copy with just under 10% altered and rescale its confidence")
  void search_TwentyFivePixelsAltered_LowConfidenceTile() {
    ImageBuffer single = SyntheticImages.distinct(16, 16, 1);
    ImageBuffer tileset = copyWithAlteredPixels(single, 25);

    List<Tile> tiles = search.search(tileset, single);

    double raw = 231.0 / 256.0;
    assertThat(tiles).hasSize(1);
    assertThat(tiles.get(0).tilesetRegion()).isEqualTo(new Region(16, 0, 16, 16));
    assertThat(tiles.get(0).confidence())
        .isCloseTo((raw - 0.9) / (1.0 - 0.9), within(1e-12))
        .isGreaterThan(0.0)
        .isLessThan(1.0);
  }

  @Test
  @DisplayName("Should never match a fully transparent single")
  void search_TransparentSingle_NoTiles() {
    ImageBuffer single = SyntheticImages.transparent(16, 16);

    assertThat(search.search(SyntheticImages.transparent(64, 64), single)).isEmpty();
    assertThat(search.search(SyntheticImages.distinct(64, 64, 4), single)).isEmpty();
  }

  @Test
  @DisplayName("Should exclude a raw score exactly at the threshold")
  void search_ScoreEqualsThreshold_Excluded() {
    ImageBuffer single = SyntheticImages.distinct(10, 1, 1);
    ImageBuffer tileset = ImageBuffer.builder(10, 1)
        .paste(single, 0, 0)
        .pixel(0, 0, SyntheticImages.distinctColor(9, 0))
        .build();

    List<Tile> atThreshold = new MatchSearch(new MatchSearchConfig(0.9, 1)).search(tileset, single);
    List<Tile> belowThreshold = new MatchSearch(new MatchSearchConfig(0.85, 1)).search(tileset, single);

    assertThat(atThreshold).isEmpty();
    assertThat(belowThreshold).hasSize(1);
    assertThat(belowThreshold.get(0).confidence()).isCloseTo(1.0 / 3.0, within(1e-9));
  }

  @Test
  @DisplayName("Should return every accepted window, including repeats of a uniform single")
  void search_UniformTileset_ReturnsAllWindows() {
    ImageBuffer single = SyntheticImages.uniform(16, 16, 0xFF336699);
    ImageBuffer tileset = SyntheticImages.uniform(48, 48, 0xFF336699);

    List<Tile> tiles = search.search(tileset, single);

    assertThat(tiles).hasSize(9);
    assertThat(tiles).allSatisfy(t -> assertThat(t.confidence()).isEqualTo(1.0));
  }

  @Test
  @DisplayName("Should keep confidences in (0, 1] for partial and clipped matches")
  void search_MixedContent_ConfidencesInRange() {
    ImageBuffer single = SyntheticImages.distinct(24, 24, 1);
    ImageBuffer tileset = ImageBuffer.builder(64, 64)
        .fill(0xFF000000)
        .paste(single, -8, -8)
        .paste(single, 40, 40)
        .paste(single, 8, 8)
        .build();

    List<Tile> tiles = new MatchSearch(new MatchSearchConfig(0.2, 8)).search(tileset, single);

    assertThat(tiles).isNotEmpty();
    assertThat(tiles).allSatisfy(t -> {
      assertThat(t.confidence()).isGreaterThan(0.0).isLessThanOrEqualTo(1.0);
      assertThat(t.tilesetRegion().sameShape(t.singleRegion())).isTrue();
    });
  }

  @Test
  @DisplayName("Should search the buffers of tileset and single assets")
  void match_Assets_DelegatesToBuffers() {
    IdAllocator ids = new IdAllocator();
    ImageBuffer pixels = SyntheticImages.distinct(16, 16, 5);

    List<Tile> tiles = search.match(SyntheticImages.tileset(ids, "pack/t.png", pixels),
        SyntheticImages.single(ids, "pack/singles/s.png", pixels));

    assertThat(tiles).hasSize(1);
  }

  @Test
  @DisplayName("Should reject thresholds outside [0, 1)")
  void config_InvalidThreshold_Throws() {
    assertThatThrownBy(() -> new MatchSearchConfig(1.0, 16)).isInstanceOf(IllegalArgumentException.class);
    assertThatThrownBy(() -> new MatchSearchConfig(-0.1, 16)).isInstanceOf(IllegalArgumentException.class);
    assertThatThrownBy(() -> new MatchSearchConfig(0.5, 0)).isInstanceOf(IllegalArgumentException.class);
  }

  private static ImageBuffer copyWithAlteredPixels(ImageBuffer single, int altered) {
    ImageBuffer.Builder b = ImageBuffer.builder(32, 16)
        .paste(SyntheticImages.distinct(16, 16, 2), 0, 0)
        .paste(single, 16, 0);
    for (int i = 0; i < altered; i++) {
      b.pixel(16 + (i % 16), i / 16, SyntheticImages.distinctColor(3, i));
    }
    return b.build();
  }
}
