package com.consullo.atlas.match;

import com.consullo.atlas.core.ImageBuffer;
import com.consullo.atlas.core.Region;
import com.consullo.atlas.core.SyntheticImages;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

/**
 * Tests for {@link MaskedScorer}.
 *
 * @since 1.0
 */
public class MaskedScorerTest {

  private final MaskedScorer scorer = new MaskedScorer();

  @Test
  @DisplayName("Should score exactly 0 for a fully transparent single against any window")
  void score_TransparentSingle_ReturnsZero() {
    ImageBuffer single = SyntheticImages.transparent(16, 16);

    assertThat(scorer.score(single, SyntheticImages.transparent(16, 16))).isEqualTo(0.0);
    assertThat(scorer.score(single, SyntheticImages.distinct(16, 16, 3))).isEqualTo(0.0);
  }

  @Test
  @DisplayName("Should score exactly 1 for byte-identical windows")
  void score_IdenticalWindows_ReturnsOne() {
    ImageBuffer single = SyntheticImages.distinct(16, 16, 1);

    assertThat(scorer.score(single, SyntheticImages.distinct(16, 16, 1))).isEqualTo(1.0);
  }

  @Test
  @DisplayName("Should ignore pixels that are not fully opaque in the single")
  void score_TranslucentSinglePixels_AreNotCompared() {
    ImageBuffer single = ImageBuffer.of(2, 1, new int[] {0xFF102030, 0x80102030});
    ImageBuffer window = ImageBuffer.of(2, 1, new int[] {0xFF102030, 0xFFFFFFFF});

    assertThat(scorer.score(single, window)).isEqualTo(1.0);
  }

  @Test
  @DisplayName("Should require agreement in the alpha channel too")
  void score_AlphaDiffers_Disagrees() {
    ImageBuffer single = ImageBuffer.of(2, 1, new int[] {0xFF102030, 0xFF102030});
    ImageBuffer window = ImageBuffer.of(2, 1, new int[] {0xFF102030, 0xFE102030});

    assertThat(scorer.score(single, window)).isEqualTo(0.5);
  }

  @Test
  @DisplayName("Should divide by the whole single's opaque count when the window is clipped")
  void score_ClippedWindow_UsesFullDenominator() {
    ImageBuffer single = SyntheticImages.distinct(16, 16, 1);
    ImageBuffer tileset = ImageBuffer.builder(8, 16).paste(single, -8, 0).build();

    double score = scorer.score(tileset, new Region(0, 0, 8, 16), single, new Region(8, 0, 8, 16),
        single.opaquePixelCount());

    assertThat(score).isEqualTo(0.5);
  }

  @Test
  @DisplayName("Should reject windows of different shape or outside their buffers")
  void score_BadWindows_Throw() {
    ImageBuffer single = SyntheticImages.distinct(4, 4, 1);
    ImageBuffer tileset = SyntheticImages.distinct(8, 8, 2);

    assertThatThrownBy(() -> scorer.score(tileset, new Region(0, 0, 4, 4), single,
        new Region(0, 0, 3, 4), 16)).isInstanceOf(IllegalArgumentException.class);
    assertThatThrownBy(() -> scorer.score(tileset, new Region(6, 0, 4, 4), single,
        new Region(0, 0, 4, 4), 16)).isInstanceOf(IllegalArgumentException.class);
    assertThatThrownBy(() -> scorer.score(single, SyntheticImages.distinct(5, 4, 1)))
        .isInstanceOf(IllegalArgumentException.class);
  }
}
