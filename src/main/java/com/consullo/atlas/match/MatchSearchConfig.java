package com.consullo.atlas.match;

/**
 * Match search configuration values.
 *
 * @param threshold minimum raw score, exclusive, in [0, 1)
 * @param stride grid step for window origins, positive
 * @since 1.0
 */
public record MatchSearchConfig(double threshold, int stride) {

  /** Default acceptance threshold. */
  public static final double DEFAULT_THRESHOLD = 0.9;

  /** Nominal tile size of the target asset packs. */
  public static final int DEFAULT_STRIDE = 16;

  public MatchSearchConfig {
    if (!(threshold >= 0.0 && threshold < 1.0)) {
      throw new IllegalArgumentException("threshold must be in [0, 1): " + threshold);
    }
    if (stride <= 0) {
      throw new IllegalArgumentException("stride must be positive.");
    }
  }

  public static MatchSearchConfig defaults() {
    return new MatchSearchConfig(DEFAULT_THRESHOLD, DEFAULT_STRIDE);
  }
}
