package com.flamingo.ai.webarchive.service.importing;

import java.time.Instant;
import java.util.UUID;
import lombok.Getter;

/** A background import and its latest observable state. */
@Getter
public class ImportJob {

  private final UUID id;
  private final UUID userId;
  private final int totalUrls;
  private final Instant startedAt;
  private final CancellationToken cancellation = new CancellationToken();

  private volatile ImportJobStatus status = ImportJobStatus.RUNNING;
  private volatile ImportProgress lastProgress;
  private volatile ImportSummary summary;
  private volatile String error;
  private volatile Instant finishedAt;

  ImportJob(UUID id, UUID userId, int totalUrls) {
    this.id = id;
    this.userId = userId;
    this.totalUrls = totalUrls;
    this.startedAt = Instant.now();
  }

  void progress(ImportProgress progress) {
    this.lastProgress = progress;
  }

  void complete(ImportSummary summary) {
    this.summary = summary;
    this.finishedAt = Instant.now();
    this.status =
        cancellation.isCancelled() ? ImportJobStatus.CANCELLED : ImportJobStatus.COMPLETED;
  }

  void fail(String error) {
    this.error = error;
    this.finishedAt = Instant.now();
    this.status = ImportJobStatus.FAILED;
  }
}
