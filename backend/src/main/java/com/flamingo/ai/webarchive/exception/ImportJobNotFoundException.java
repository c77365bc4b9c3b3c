package com.flamingo.ai.webarchive.exception;

import java.util.UUID;

/** Thrown for an unknown or already evicted import job id. */
public class ImportJobNotFoundException extends RuntimeException {

  private final UUID jobId;

  public ImportJobNotFoundException(UUID jobId) {
    super("Import job not found: " + jobId);
    this.jobId = jobId;
  }

  public UUID getJobId() {
    return jobId;
  }
}
