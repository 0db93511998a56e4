package com.consullo.atlas.dispatch;

/**
 * Parallel dispatcher configuration values.
 *
 * @param workerCount number of worker threads
 * @param batchSize number of pairs handed to a worker per task
 * @since 1.0
 */
public record DispatcherConfig(int workerCount, int batchSize) {

  public static final int DEFAULT_WORKER_COUNT = 12;

  public static final int DEFAULT_BATCH_SIZE = 32;

  public DispatcherConfig {
    if (workerCount <= 0) {
      throw new IllegalArgumentException("workerCount must be positive.");
    }
    if (batchSize <= 0) {
      throw new IllegalArgumentException("batchSize must be positive.");
    }
  }

  public static DispatcherConfig defaults() {
    return new DispatcherConfig(DEFAULT_WORKER_COUNT, DEFAULT_BATCH_SIZE);
  }
}
