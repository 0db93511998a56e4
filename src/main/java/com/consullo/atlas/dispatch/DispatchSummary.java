package com.consullo.atlas.dispatch;

/**
 * Totals of a completed dispatcher run.
 *
 * @param pairsSearched pairs searched
 * @param pairsMatched pairs with at least one accepted tile
 * @param matchCount accepted tiles across all pairs
 * @since 1.0
 */
public record DispatchSummary(int pairsSearched, int pairsMatched, long matchCount) {
}
