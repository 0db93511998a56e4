package com.consullo.atlas.dispatch;

/**
 * Progress callback for dispatcher runs.
 *
 * <p>Invoked on the coordinating thread as each pair's result arrives.
 * Association state is written only after the last pair has been searched.
 *
 * @since 1.0
 */
@FunctionalInterface
public interface DispatchListener {

  /**
   * Called once per searched pair.
   *
   * @param pair pair that was searched
   * @param tileCount accepted tiles for the pair
   * @param completed pairs searched so far, including this one
   * @param total pairs in the run
   */
  void onPairSearched(CandidatePair pair, int tileCount, int completed, int total);

  static DispatchListener none() {
    return (pair, tileCount, completed, total) -> {
    };
  }
}
