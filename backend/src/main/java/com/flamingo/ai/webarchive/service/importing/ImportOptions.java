package com.flamingo.ai.webarchive.service.importing;

import com.flamingo.ai.webarchive.config.ArchiveConfig;

/**
 * Pacing of one import run.
 *
 * @param batchSize items processed concurrently per batch
 * @param delayBetweenBatchesMs pause after every batch except the last
 * @param delayBetweenRequestsMs base of the linear backoff between extraction attempts
 * @param maxRetries extraction attempts after the first one
 */
public record ImportOptions(
    int batchSize, long delayBetweenBatchesMs, long delayBetweenRequestsMs, int maxRetries) {

  public ImportOptions {
    if (batchSize < 1) {
      throw new IllegalArgumentException("batchSize must be at least 1: " + batchSize);
    }
    if (delayBetweenBatchesMs < 0 || delayBetweenRequestsMs < 0 || maxRetries < 0) {
      throw new IllegalArgumentException("delays and maxRetries must not be negative");
    }
  }

  public static ImportOptions defaults(ArchiveConfig.Importing importing) {
    return new ImportOptions(
        Math.min(importing.getBatchSize(), importing.getMaxBatchSize()),
        importing.getDelayBetweenBatchesMs(),
        importing.getDelayBetweenRequestsMs(),
        importing.getMaxRetries());
  }

  /**
   * Merges caller overrides with the configured defaults. Null, a batch size below 1 and negative
   * values fall back to the default; a batch size above {@code maxBatchSize} is capped, since the
   * item pool only holds that many workers per job.
   */
  public static ImportOptions resolve(
      Integer batchSize,
      Long delayBetweenBatchesMs,
      Long delayBetweenRequestsMs,
      Integer maxRetries,
      ArchiveConfig.Importing importing) {
    return new ImportOptions(
        Math.min(
            batchSize != null && batchSize > 0 ? batchSize : importing.getBatchSize(),
            importing.getMaxBatchSize()),
        delayBetweenBatchesMs != null && delayBetweenBatchesMs >= 0
            ? delayBetweenBatchesMs
            : importing.getDelayBetweenBatchesMs(),
        delayBetweenRequestsMs != null && delayBetweenRequestsMs >= 0
            ? delayBetweenRequestsMs
            : importing.getDelayBetweenRequestsMs(),
        maxRetries != null && maxRetries >= 0 ? maxRetries : importing.getMaxRetries());
  }
}
