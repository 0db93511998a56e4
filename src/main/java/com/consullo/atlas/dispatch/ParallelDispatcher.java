package com.consullo.atlas.dispatch;

import com.consullo.atlas.core.Single;
import com.consullo.atlas.core.Tile;
import com.consullo.atlas.core.Tileset;
import com.consullo.atlas.match.PairMatcher;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.concurrent.BlockingQueue;
import java.util.concurrent.CompletionService;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorCompletionService;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.LinkedBlockingQueue;
import org.apache.commons.lang3.Validate;
import org.apache.commons.lang3.concurrent.BasicThreadFactory;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Searches many (tileset, single) pairs on a fixed worker pool and merges the results.
 *
 * <p>
 * Strategy:
 * </p>
 * <ul>
 * <li>Collapse duplicate pairs, then cut the list into batches.</li>
 * <li>Each batch is one task on a fixed pool; workers only read image buffers.</li>
 * <li>Finished batches arrive on a single result queue in any order.</li>
 * <li>The calling thread drains the queue and is the only writer of {@link Single} and
 * {@link Tileset} association state, so arrival order never shows in the outcome.</li>
 * <li>Association state is written only once every batch has returned.</li>
 * <li>The first failing pair aborts the run, cancels outstanding batches and leaves every
 * {@link Single} and {@link Tileset} untouched.</li>
 * </ul>
 *
 * @since 1.0
 */
public final class ParallelDispatcher {

  private static final Logger LOGGER = LoggerFactory.getLogger(ParallelDispatcher.class);

  private final DispatcherConfig config;
  private final PairMatcher matcher;
  private final DispatchListener listener;

  public ParallelDispatcher(DispatcherConfig config, PairMatcher matcher) {
    this(config, matcher, DispatchListener.none());
  }

  public ParallelDispatcher(DispatcherConfig config, PairMatcher matcher, DispatchListener listener) {
    if (config == null || matcher == null || listener == null) {
      throw new IllegalArgumentException("config/matcher/listener must not be null.");
    }
    this.config = config;
    this.matcher = matcher;
    this.listener = listener;
  }

  /**
   * Searches every candidate pair and aggregates accepted tiles into the pairs' tilesets and
   * singles. Blocks until all pairs are done.
   *
   * @param candidates candidate pairs, typically pre-filtered
   * @return run totals
   * @throws MatchRunException if any pair's search fails or the caller is interrupted
   */
  public DispatchSummary run(List<CandidatePair> candidates) throws MatchRunException {
    Validate.notNull(candidates, "candidates must not be null");
    Validate.noNullElements(candidates, "candidates must not contain null pairs");

    List<CandidatePair> pairs = distinct(candidates);
    int total = pairs.size();
    LOGGER.info("Searching {} pairs on {} workers...", total, config.workerCount());
    if (total == 0) {
      return new DispatchSummary(0, 0, 0L);
    }

    ExecutorService pool = Executors.newFixedThreadPool(config.workerCount(),
        new BasicThreadFactory.Builder()
            .namingPattern("tile-match-%d")
            .daemon(true)
            .build());
    BlockingQueue<Future<List<PairResult>>> results = new LinkedBlockingQueue<>();
    CompletionService<List<PairResult>> completion = new ExecutorCompletionService<>(pool, results);

    try {
      int batches = 0;
      for (int start = 0; start < total; start += config.batchSize()) {
        List<CandidatePair> batch = pairs.subList(start, Math.min(total, start + config.batchSize()));
        completion.submit(() -> searchBatch(batch));
        batches++;
      }
      LOGGER.debug("run: submitted {} batches of up to {} pairs", batches, config.batchSize());

      Aggregation aggregation = new Aggregation(total);
      for (int b = 0; b < batches; b++) {
        for (PairResult r : completion.take().get()) {
          aggregation.collect(r);
        }
      }

      DispatchSummary summary = aggregation.apply();
      LOGGER.info("Found {} matches in {} of {} pairs.", summary.matchCount(),
          summary.pairsMatched(), summary.pairsSearched());
      return summary;
    } catch (ExecutionException e) {
      throw failure(e.getCause());
    } catch (InterruptedException e) {
      Thread.currentThread().interrupt();
      throw new MatchRunException("Interrupted while waiting for pair searches.", null, null, e);
    } finally {
      pool.shutdownNow();
    }
  }

  private List<PairResult> searchBatch(List<CandidatePair> batch) {
    List<PairResult> out = new ArrayList<>(batch.size());
    for (CandidatePair pair : batch) {
      List<Tile> tiles;
      try {
        tiles = matcher.match(pair.tileset(), pair.single());
      } catch (RuntimeException e) {
        throw new PairSearchFailure(pair, e);
      }
      if (tiles == null) {
        throw new PairSearchFailure(pair, new IllegalStateException("matcher returned null"));
      }
      out.add(new PairResult(pair, List.copyOf(tiles)));
    }
    return out;
  }

  private static MatchRunException failure(Throwable cause) {
    if (cause instanceof PairSearchFailure) {
      PairSearchFailure f = (PairSearchFailure) cause;
      CandidatePair pair = f.pair;
      LOGGER.error("Search failed for pair {}: {}", pair, f.getCause().getMessage());
      return new MatchRunException("Search failed for pair " + pair, pair.tileset().id(),
          pair.single().id(), f.getCause());
    }
    LOGGER.error("Search worker failed: {}", String.valueOf(cause));
    return new MatchRunException("Search worker failed.", null, null, cause);
  }

  private static List<CandidatePair> distinct(List<CandidatePair> candidates) {
    Map<CandidatePair.Key, CandidatePair> unique = new LinkedHashMap<>();
    for (CandidatePair pair : candidates) {
      unique.putIfAbsent(pair.key(), pair);
    }
    if (unique.size() != candidates.size()) {
      LOGGER.debug("distinct: dropped {} duplicate pairs", candidates.size() - unique.size());
    }
    return new ArrayList<>(unique.values());
  }

  /**
   * Coordinating-thread-only merge of pair results. Results are collected as they arrive and
   * written to the assets in {@link #apply()}.
   */
  private final class Aggregation {

    private final int total;
    private final List<PairResult> found = new ArrayList<>();
    private int completed;

    Aggregation(int total) {
      this.total = total;
    }

    void collect(PairResult r) {
      completed++;
      if (!r.tiles().isEmpty()) {
        found.add(r);
      }
      listener.onPairSearched(r.pair(), r.tiles().size(), completed, total);
    }

    DispatchSummary apply() {
      long tiles = 0L;
      for (PairResult r : found) {
        Tileset tileset = r.pair().tileset();
        Single single = r.pair().single();
        single.addTileset(tileset.id());
        for (Tile tile : r.tiles()) {
          tileset.addTile(single.id(), tile);
        }
        tiles += r.tiles().size();
      }
      return new DispatchSummary(completed, found.size(), tiles);
    }
  }

  private record PairResult(CandidatePair pair, List<Tile> tiles) {
  }

  private static final class PairSearchFailure extends RuntimeException {

    private static final long serialVersionUID = 1L;

    private final transient CandidatePair pair;

    PairSearchFailure(CandidatePair pair, Throwable cause) {
      super("Search failed for pair " + pair, cause);
      this.pair = pair;
    }
  }
}
