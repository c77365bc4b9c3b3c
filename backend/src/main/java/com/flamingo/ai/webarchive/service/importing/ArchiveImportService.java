package com.flamingo.ai.webarchive.service.importing;

import com.flamingo.ai.webarchive.domain.entity.ArchiveRecord;
import com.flamingo.ai.webarchive.domain.repository.ArchiveRecordRepository;
import com.flamingo.ai.webarchive.service.ingest.embedding.SharedEmbeddingStore;
import com.flamingo.ai.webarchive.service.ingest.extraction.ContentExtractor;
import com.flamingo.ai.webarchive.service.ingest.extraction.ExtractedContent;
import com.google.common.annotations.VisibleForTesting;
import com.google.common.collect.Lists;
import io.micrometer.core.annotation.Timed;
import io.micrometer.core.instrument.MeterRegistry;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;
import java.util.UUID;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.Executor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.dao.DataIntegrityViolationException;
import org.springframework.stereotype.Service;

/**
 * Imports a list of urls into a user's archive.
 *
 * <p>Already archived urls are filtered first. The rest is processed in sequential batches whose
 * items run concurrently; each item is re-checked, extracted with linear-backoff retries, stored,
 * and handed to the shared embedding store. A failing item is recorded and never stops the run.
 * Cancellation stops new batches from starting; items in flight complete.
 */
@Service
@Slf4j
public class ArchiveImportService {

  private static final String UNTITLED = "Untitled";

  private final DuplicateDetector duplicateDetector;
  private final ContentExtractor contentExtractor;
  private final ArchiveRecordRepository archiveRecordRepository;
  private final SharedEmbeddingStore sharedEmbeddingStore;
  private final Executor importItemExecutor;
  private final MeterRegistry meterRegistry;
  private final Sleeper sleeper;

  @Autowired
  public ArchiveImportService(
      DuplicateDetector duplicateDetector,
      ContentExtractor contentExtractor,
      ArchiveRecordRepository archiveRecordRepository,
      SharedEmbeddingStore sharedEmbeddingStore,
      @Qualifier("importItemExecutor") Executor importItemExecutor,
      MeterRegistry meterRegistry) {
    this(
        duplicateDetector,
        contentExtractor,
        archiveRecordRepository,
        sharedEmbeddingStore,
        importItemExecutor,
        meterRegistry,
        Thread::sleep);
  }

  @VisibleForTesting
  ArchiveImportService(
      DuplicateDetector duplicateDetector,
      ContentExtractor contentExtractor,
      ArchiveRecordRepository archiveRecordRepository,
      SharedEmbeddingStore sharedEmbeddingStore,
      Executor importItemExecutor,
      MeterRegistry meterRegistry,
      Sleeper sleeper) {
    this.duplicateDetector = duplicateDetector;
    this.contentExtractor = contentExtractor;
    this.archiveRecordRepository = archiveRecordRepository;
    this.sharedEmbeddingStore = sharedEmbeddingStore;
    this.importItemExecutor = importItemExecutor;
    this.meterRegistry = meterRegistry;
    this.sleeper = sleeper;
  }

  /** Runs an import to completion. */
  public ImportSummary run(List<ImportItem> items, UUID userId, ImportOptions options) {
    return run(items, userId, options, ImportProgressListener.NONE, new CancellationToken());
  }

  @Timed(value = "import.run", description = "Time to run a whole import")
  public ImportSummary run(
      List<ImportItem> items,
      UUID userId,
      ImportOptions options,
      ImportProgressListener listener,
      CancellationToken cancellation) {
    ImportTally tally = new ImportTally(items.size());
    DuplicatePartition partition = duplicateDetector.partition(items, userId);
    tally.addDuplicates(partition.duplicates().size());

    List<List<ImportItem>> batches = Lists.partition(partition.fresh(), options.batchSize());
    log.info(
        "Starting import for user {}: {} total URLs, {} duplicates, {} new in {} batches",
        userId,
        items.size(),
        partition.duplicates().size(),
        partition.fresh().size(),
        batches.size());

    for (int i = 0; i < batches.size(); i++) {
      if (cancellation.isCancelled()) {
        int remaining = batches.subList(i, batches.size()).stream().mapToInt(List::size).sum();
        tally.addCancelled(remaining);
        log.info("Import for user {} cancelled, {} URLs not started", userId, remaining);
        break;
      }

      List<ImportItem> batch = batches.get(i);
      log.info("Processing batch {}/{} ({} URLs)", i + 1, batches.size(), batch.size());
      runBatch(batch, userId, options, tally, listener);

      boolean lastBatch = i == batches.size() - 1;
      if (!lastBatch && !pause(options.delayBetweenBatchesMs())) {
        cancellation.cancel();
      }
    }

    ImportSummary summary = tally.summary();
    log.info(
        "Import complete for user {}: {} successful, {} failed, {} skipped ({} duplicates)",
        userId,
        summary.successful(),
        summary.failed(),
        summary.skipped(),
        summary.duplicates());
    return summary;
  }

  private void runBatch(
      List<ImportItem> batch,
      UUID userId,
      ImportOptions options,
      ImportTally tally,
      ImportProgressListener listener) {
    List<CompletableFuture<Void>> futures = new ArrayList<>(batch.size());
    for (ImportItem item : batch) {
      futures.add(
          CompletableFuture.supplyAsync(() -> importOne(item, userId, options), importItemExecutor)
              .exceptionally(t -> ImportResult.failed(item.url(), t.getMessage(), 0))
              .thenAccept(result -> report(tally.record(result), listener)));
    }
    CompletableFuture.allOf(futures.toArray(CompletableFuture[]::new)).join();
  }

  private void report(ImportProgress progress, ImportProgressListener listener) {
    meterRegistry
        .counter("import.items", "outcome", outcome(progress.currentResult()))
        .increment();
    try {
      listener.onProgress(progress);
    } catch (RuntimeException e) {
      log.warn("Progress listener failed for {}: {}", progress.currentUrl(), e.getMessage());
    }
  }

  /** Imports one item; never throws. */
  ImportResult importOne(ImportItem item, UUID userId, ImportOptions options) {
    String url = item.url();
    try {
      Optional<ArchiveRecord> existing = archiveRecordRepository.findByUserIdAndUrl(userId, url);
      if (existing.isPresent()) {
        log.info("URL already exists in archive: {}", url);
        ArchiveRecord archived = existing.get();
        return ImportResult.alreadyArchived(url, archived.getId(), archived.getTitle());
      }

      Extraction extraction = extractWithRetries(url, options);
      if (extraction.content() == null) {
        log.error(
            "Failed to archive {} after {} attempts: {}",
            url,
            extraction.attempts(),
            extraction.error());
        return ImportResult.failed(url, extraction.error(), extraction.attempts());
      }

      ArchiveRecord saved;
      try {
        saved = archiveRecordRepository.saveAndFlush(toRecord(item, userId, extraction.content()));
      } catch (DataIntegrityViolationException e) {
        // archived concurrently since the re-check
        Optional<ArchiveRecord> winner = archiveRecordRepository.findByUserIdAndUrl(userId, url);
        if (winner.isPresent()) {
          return ImportResult.alreadyArchived(url, winner.get().getId(), winner.get().getTitle());
        }
        throw e;
      }
      log.info("Successfully archived: {}", saved.getTitle());

      try {
        sharedEmbeddingStore.embedArchive(saved);
      } catch (RuntimeException e) {
        log.warn(
            "Embedding failed for archive {} ({}), kept without chunks: {}",
            saved.getId(),
            url,
            e.getMessage());
      }
      return ImportResult.archived(url, saved.getId(), saved.getTitle(), extraction.attempts());
    } catch (RuntimeException e) {
      log.error("Failed to archive {}: {}", url, e.getMessage(), e);
      return ImportResult.failed(url, e.getMessage(), 0);
    }
  }

  /** Tries {@code 1 + maxRetries} times, sleeping {@code delay * attempt} between attempts. */
  private Extraction extractWithRetries(String url, ImportOptions options) {
    int maxAttempts = options.maxRetries() + 1;
    String lastError = null;
    for (int attempt = 1; attempt <= maxAttempts; attempt++) {
      try {
        return new Extraction(contentExtractor.extract(url), attempt, null);
      } catch (RuntimeException e) {
        lastError = e.getMessage();
        if (attempt < maxAttempts) {
          log.info("Retry {}/{} for {}: {}", attempt, options.maxRetries(), url, lastError);
          if (!pause(options.delayBetweenRequestsMs() * attempt)) {
            return new Extraction(null, attempt, "Interrupted while waiting to retry");
          }
        }
      }
    }
    return new Extraction(null, maxAttempts, lastError);
  }

  private static ArchiveRecord toRecord(ImportItem item, UUID userId, ExtractedContent content) {
    String title = content.title();
    if (title == null || title.isBlank() || UNTITLED.equals(title)) {
      title = item.title() == null || item.title().isBlank() ? UNTITLED : item.title();
    }
    return ArchiveRecord.builder()
        .userId(userId)
        .url(item.url())
        .title(title)
        .description(content.description())
        .textContent(content.text())
        .markdownContent(content.markdown())
        .wordCount(content.wordCount())
        .readingTime(content.readingTime())
        .extractionMethod(content.extractionMethod())
        .tags(new ArrayList<>(item.tags()))
        .timeAdded(item.timeAdded())
        .build();
  }

  /** Sleeps; returns false if the thread was interrupted. */
  private boolean pause(long millis) {
    if (millis <= 0) {
      return true;
    }
    try {
      sleeper.sleep(millis);
      return true;
    } catch (InterruptedException e) {
      Thread.currentThread().interrupt();
      return false;
    }
  }

  private static String outcome(ImportResult result) {
    if (!result.success()) {
      return "failed";
    }
    return result.skipped() ? "skipped" : "archived";
  }

  private record Extraction(ExtractedContent content, int attempts, String error) {}

  /** Blocks the calling thread between batches and between extraction attempts. */
  @FunctionalInterface
  interface Sleeper {
    void sleep(long millis) throws InterruptedException;
  }
}
