package com.flamingo.ai.webarchive.service.importing;

import com.flamingo.ai.webarchive.config.ArchiveConfig;
import com.flamingo.ai.webarchive.domain.entity.ArchiveRecord;
import com.flamingo.ai.webarchive.domain.repository.ArchiveRecordRepository;
import com.flamingo.ai.webarchive.exception.ImportJobNotFoundException;
import com.flamingo.ai.webarchive.exception.ImportValidationException;
import jakarta.annotation.PreDestroy;
import java.time.Duration;
import java.time.Instant;
import java.time.LocalDateTime;
import java.util.List;
import java.util.Map;
import java.util.UUID;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.Executor;
import java.util.concurrent.RejectedExecutionException;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.stereotype.Service;

/**
 * Entry point for imports: validation, preview, and supervised background jobs.
 *
 * <p>Jobs are kept in memory. Finished jobs are evicted an hour after they end; running jobs are
 * cancelled at shutdown and the job executor waits for their in-flight items.
 */
@Service
@Slf4j
public class ImportJobService {

  private static final Duration FINISHED_JOB_RETENTION = Duration.ofHours(1);

  private final ImportListParser importListParser;
  private final DuplicateDetector duplicateDetector;
  private final ArchiveImportService archiveImportService;
  private final ArchiveRecordRepository archiveRecordRepository;
  private final ArchiveConfig archiveConfig;
  private final Executor importJobExecutor;

  private final Map<UUID, ImportJob> jobs = new ConcurrentHashMap<>();

  public ImportJobService(
      ImportListParser importListParser,
      DuplicateDetector duplicateDetector,
      ArchiveImportService archiveImportService,
      ArchiveRecordRepository archiveRecordRepository,
      ArchiveConfig archiveConfig,
      @Qualifier("importJobExecutor") Executor importJobExecutor) {
    this.importListParser = importListParser;
    this.duplicateDetector = duplicateDetector;
    this.archiveImportService = archiveImportService;
    this.archiveRecordRepository = archiveRecordRepository;
    this.archiveConfig = archiveConfig;
    this.importJobExecutor = importJobExecutor;
  }

  /** Validates and parses a list and reports how many urls are new for the user. */
  public ImportPreview preview(String csvContent, UUID userId) {
    importListParser.validate(csvContent);
    List<ImportItem> items = importListParser.parse(csvContent);

    DuplicatePartition partition = new DuplicatePartition(items, List.of());
    if (userId != null) {
      try {
        partition = duplicateDetector.partition(items, userId);
      } catch (RuntimeException e) {
        log.warn(
            "Duplicate check failed during preview, showing all URLs as new: {}", e.getMessage());
      }
    }

    ArchiveConfig.Importing importing = archiveConfig.getImporting();
    List<ImportItem> fresh = partition.fresh();
    List<ImportItem> duplicates = partition.duplicates();
    return new ImportPreview(
        items.size(),
        fresh.size(),
        duplicates.size(),
        fresh.subList(0, Math.min(fresh.size(), importing.getPreviewSize())),
        fresh.size() > importing.getPreviewSize(),
        duplicates.subList(0, Math.min(duplicates.size(), importing.getDuplicatePreviewSize())));
  }

  /**
   * Starts a background import.
   *
   * @throws ImportValidationException if the list is invalid or empty or over the per-import limit
   */
  public ImportJob start(String csvContent, UUID userId, ImportOptions options) {
    importListParser.validate(csvContent);
    List<ImportItem> items = importListParser.parse(csvContent);
    if (items.isEmpty()) {
      throw new ImportValidationException("No valid URLs found in CSV");
    }
    int limit = archiveConfig.getImporting().getMaxUrlsPerImport();
    if (items.size() > limit) {
      throw new ImportValidationException(
          "Import of " + items.size() + " URLs exceeds the limit of " + limit);
    }

    evictFinishedJobs();
    ImportJob job = new ImportJob(UUID.randomUUID(), userId, items.size());
    jobs.put(job.getId(), job);
    log.info("Starting import job {} for user {} with {} URLs", job.getId(), userId, items.size());

    try {
      importJobExecutor.execute(() -> runJob(job, items, options));
    } catch (RejectedExecutionException e) {
      // kept as FAILED so the caller can still look it up; evicted like any finished job
      log.warn("Import job {} rejected by the job executor: {}", job.getId(), e.getMessage());
      job.fail("Too many imports are running, try again later");
    }
    return job;
  }

  private void runJob(ImportJob job, List<ImportItem> items, ImportOptions options) {
    try {
      ImportSummary summary =
          archiveImportService.run(
              items, job.getUserId(), options, job::progress, job.getCancellation());
      job.complete(summary);
      log.info("Import job {} finished with status {}", job.getId(), job.getStatus());
    } catch (RuntimeException e) {
      log.error("Import job {} failed: {}", job.getId(), e.getMessage(), e);
      job.fail(e.getMessage());
    }
  }

  public ImportJob get(UUID jobId) {
    ImportJob job = jobs.get(jobId);
    if (job == null) {
      throw new ImportJobNotFoundException(jobId);
    }
    return job;
  }

  /** Requests cancellation; batches already running complete. */
  public ImportJob cancel(UUID jobId) {
    ImportJob job = get(jobId);
    if (!job.getStatus().isFinished()) {
      job.getCancellation().cancel();
      log.info("Cancellation requested for import job {}", jobId);
    }
    return job;
  }

  /** Archives the user created within the configured recent window, newest first. */
  public List<ArchiveRecord> recentImports(UUID userId) {
    LocalDateTime since =
        LocalDateTime.now().minusHours(archiveConfig.getImporting().getRecentWindowHours());
    return archiveRecordRepository.findByUserIdAndCreatedAtAfterOrderByCreatedAtDesc(userId, since);
  }

  /** Estimated duration at roughly two seconds per url. */
  public static int estimatedMinutes(int urlCount) {
    return (int) Math.ceil(urlCount * 2 / 60.0);
  }

  private void evictFinishedJobs() {
    Instant cutoff = Instant.now().minus(FINISHED_JOB_RETENTION);
    jobs.values()
        .removeIf(
            job -> job.getStatus().isFinished() && job.getFinishedAt().isBefore(cutoff));
  }

  @PreDestroy
  public void shutdown() {
    jobs.values().stream()
        .filter(job -> !job.getStatus().isFinished())
        .forEach(
            job -> {
              log.info("Cancelling import job {} for shutdown", job.getId());
              job.getCancellation().cancel();
            });
  }
}
