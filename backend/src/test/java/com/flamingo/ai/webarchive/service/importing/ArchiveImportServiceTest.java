package com.flamingo.ai.webarchive.service.importing;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.times;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

import com.flamingo.ai.webarchive.config.ArchiveConfig;
import com.flamingo.ai.webarchive.domain.entity.ArchiveRecord;
import com.flamingo.ai.webarchive.domain.repository.ArchiveRecordRepository;
import com.flamingo.ai.webarchive.exception.ExtractionException;
import com.flamingo.ai.webarchive.service.ingest.embedding.SharedEmbeddingStore;
import com.flamingo.ai.webarchive.service.ingest.extraction.ContentExtractor;
import com.flamingo.ai.webarchive.service.ingest.extraction.ExtractedContent;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import java.time.Instant;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collections;
import java.util.List;
import java.util.Optional;
import java.util.UUID;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.Executor;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicBoolean;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.ArgumentCaptor;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import org.springframework.dao.DataIntegrityViolationException;

@ExtendWith(MockitoExtension.class)
class ArchiveImportServiceTest {

  private static final ImportOptions NO_DELAYS = new ImportOptions(3, 0, 0, 2);

  @Mock private ContentExtractor contentExtractor;
  @Mock private ArchiveRecordRepository archiveRecordRepository;
  @Mock private SharedEmbeddingStore sharedEmbeddingStore;

  private final SimpleMeterRegistry meterRegistry = new SimpleMeterRegistry();
  private final List<Long> sleeps = Collections.synchronizedList(new ArrayList<>());

  private ArchiveImportService archiveImportService;
  private UUID userId;

  @BeforeEach
  void setUp() {
    archiveImportService = importService(Runnable::run);
    userId = UUID.randomUUID();
  }

  private ArchiveImportService importService(Executor executor) {
    DuplicateDetector duplicateDetector =
        new DuplicateDetector(archiveRecordRepository, new ArchiveConfig(), meterRegistry);
    return new ArchiveImportService(
        duplicateDetector,
        contentExtractor,
        archiveRecordRepository,
        sharedEmbeddingStore,
        executor,
        meterRegistry,
        sleeps::add);
  }

  @Nested
  @DisplayName("deduplication")
  class DeduplicationTests {

    @Test
    @DisplayName("should skip urls the user already archived and import the rest")
    void shouldSkipArchivedUrls() {
      when(archiveRecordRepository.findArchivedUrls(eq(userId), any()))
          .thenReturn(List.of("https://b.com"));
      when(contentExtractor.extract(anyString())).thenReturn(content("Page"));
      stubSave();

      ImportSummary summary =
          archiveImportService.run(
              items("https://a.com", "https://b.com", "https://c.com"), userId, NO_DELAYS);

      assertThat(summary.total()).isEqualTo(3);
      assertThat(summary.successful()).isEqualTo(2);
      assertThat(summary.duplicates()).isEqualTo(1);
      assertThat(summary.skipped()).isEqualTo(1);
      assertThat(summary.failed()).isZero();
      verify(contentExtractor, never()).extract("https://b.com");
    }

    @Test
    @DisplayName("should import nothing when every url is already archived")
    void shouldReportAllDuplicatesOnReimport() {
      when(archiveRecordRepository.findArchivedUrls(eq(userId), any()))
          .thenReturn(List.of("https://a.com", "https://b.com"));

      ImportSummary summary =
          archiveImportService.run(items("https://a.com", "https://b.com"), userId, NO_DELAYS);

      assertThat(summary.duplicates()).isEqualTo(summary.total());
      assertThat(summary.successful()).isZero();
      verify(contentExtractor, never()).extract(anyString());
    }

    @Test
    @DisplayName("should report an item archived concurrently as skipped")
    void shouldTreatConstraintViolationAsAlreadyArchived() {
      ArchiveRecord winner =
          ArchiveRecord.builder().id(UUID.randomUUID()).userId(userId).title("Winner").build();
      when(archiveRecordRepository.findByUserIdAndUrl(userId, "https://a.com"))
          .thenReturn(Optional.empty(), Optional.of(winner));
      when(contentExtractor.extract("https://a.com")).thenReturn(content("Page"));
      when(archiveRecordRepository.saveAndFlush(any()))
          .thenThrow(new DataIntegrityViolationException("UNIQUE constraint failed"));

      ImportSummary summary = archiveImportService.run(items("https://a.com"), userId, NO_DELAYS);

      assertThat(summary.skipped()).isEqualTo(1);
      assertThat(summary.results().get(0).archiveId()).isEqualTo(winner.getId());
      verify(sharedEmbeddingStore, never()).embedArchive(any());
    }
  }

  @Nested
  @DisplayName("retries")
  class RetryTests {

    @Test
    @DisplayName("should give up after maxRetries + 1 attempts")
    void shouldBoundAttempts() {
      when(contentExtractor.extract("https://a.com"))
          .thenThrow(new ExtractionException("https://a.com", "HTTP 503"));

      ImportSummary summary = archiveImportService.run(items("https://a.com"), userId, NO_DELAYS);

      verify(contentExtractor, times(3)).extract("https://a.com");
      assertThat(summary.failed()).isEqualTo(1);
      ImportResult result = summary.results().get(0);
      assertThat(result.success()).isFalse();
      assertThat(result.attempts()).isEqualTo(3);
      assertThat(result.error()).isEqualTo("HTTP 503");
    }

    @Test
    @DisplayName("should succeed when a retry succeeds")
    void shouldSucceedOnRetry() {
      when(contentExtractor.extract("https://a.com"))
          .thenThrow(new ExtractionException("https://a.com", "timeout"))
          .thenReturn(content("Page"));
      stubSave();

      ImportSummary summary = archiveImportService.run(items("https://a.com"), userId, NO_DELAYS);

      assertThat(summary.successful()).isEqualTo(1);
      assertThat(summary.results().get(0).attempts()).isEqualTo(2);
    }
  }

  @Nested
  @DisplayName("cancellation")
  class CancellationTests {

    @Test
    @DisplayName("should stop starting batches once cancelled")
    void shouldStopAfterCancellation() {
      when(contentExtractor.extract(anyString())).thenReturn(content("Page"));
      stubSave();
      CancellationToken cancellation = new CancellationToken();

      ImportSummary summary =
          archiveImportService.run(
              items("https://a.com", "https://b.com", "https://c.com"),
              userId,
              new ImportOptions(1, 0, 0, 0),
              progress -> cancellation.cancel(),
              cancellation);

      assertThat(summary.successful()).isEqualTo(1);
      assertThat(summary.cancelled()).isEqualTo(2);
      assertThat(
              summary.successful() + summary.failed() + summary.skipped() + summary.cancelled())
          .isEqualTo(summary.total());
    }
  }

  @Nested
  @DisplayName("pacing")
  class PacingTests {

    @Test
    @DisplayName("should run a batch concurrently and record results as items finish")
    void shouldRunBatchConcurrently() throws InterruptedException {
      ExecutorService executor = Executors.newFixedThreadPool(3);
      CountDownLatch allStarted = new CountDownLatch(3);
      AtomicBoolean overlapped = new AtomicBoolean(true);
      when(contentExtractor.extract(anyString()))
          .thenAnswer(
              invocation -> {
                allStarted.countDown();
                if (!allStarted.await(5, TimeUnit.SECONDS)) {
                  overlapped.set(false);
                }
                String url = invocation.getArgument(0);
                if (url.equals("https://a.com")) {
                  Thread.sleep(300);
                } else if (url.equals("https://b.com")) {
                  Thread.sleep(150);
                }
                return content("Page");
              });
      stubSave();

      try {
        ImportSummary summary =
            importService(executor)
                .run(
                    items("https://a.com", "https://b.com", "https://c.com"),
                    userId,
                    new ImportOptions(3, 0, 0, 0));

        assertThat(overlapped).isTrue();
        assertThat(summary.successful()).isEqualTo(3);
        assertThat(summary.results())
            .extracting(ImportResult::url)
            .containsExactly("https://c.com", "https://b.com", "https://a.com");
      } finally {
        executor.shutdownNow();
      }
    }

    @Test
    @DisplayName("should back off linearly and pause between batches but not after the last")
    void shouldPauseBetweenBatchesAndRetries() {
      when(contentExtractor.extract(anyString())).thenReturn(content("Page"));
      when(contentExtractor.extract("https://c.com"))
          .thenThrow(new ExtractionException("https://c.com", "HTTP 500"));
      stubSave();

      ImportSummary summary =
          archiveImportService.run(
              items(
                  "https://a.com",
                  "https://b.com",
                  "https://c.com",
                  "https://d.com",
                  "https://e.com"),
              userId,
              new ImportOptions(2, 1000, 100, 2));

      assertThat(summary.successful()).isEqualTo(4);
      assertThat(summary.failed()).isEqualTo(1);
      assertThat(sleeps).containsExactly(1000L, 100L, 200L, 1000L);
    }

    @Test
    @DisplayName("should not pause after a single batch")
    void shouldNotPauseAfterOnlyBatch() {
      when(contentExtractor.extract(anyString())).thenReturn(content("Page"));
      stubSave();

      archiveImportService.run(
          items("https://a.com", "https://b.com"), userId, new ImportOptions(3, 1000, 100, 2));

      assertThat(sleeps).isEmpty();
    }
  }

  @Test
  @DisplayName("should report progress up to the total")
  void shouldReportProgress() {
    when(archiveRecordRepository.findArchivedUrls(eq(userId), any()))
        .thenReturn(List.of("https://b.com"));
    when(contentExtractor.extract(anyString())).thenReturn(content("Page"));
    stubSave();
    List<ImportProgress> updates = new ArrayList<>();

    archiveImportService.run(
        items("https://a.com", "https://b.com", "https://c.com"),
        userId,
        NO_DELAYS,
        updates::add,
        new CancellationToken());

    assertThat(updates).hasSize(2);
    assertThat(updates.get(1).processed()).isEqualTo(3);
    assertThat(updates.get(1).total()).isEqualTo(3);
  }

  @Test
  @DisplayName("should keep the archive when embedding fails")
  void shouldKeepArchiveWhenEmbeddingFails() {
    when(contentExtractor.extract("https://a.com")).thenReturn(content("Page"));
    stubSave();
    when(sharedEmbeddingStore.embedArchive(any())).thenThrow(new IllegalStateException("boom"));

    ImportSummary summary = archiveImportService.run(items("https://a.com"), userId, NO_DELAYS);

    assertThat(summary.successful()).isEqualTo(1);
  }

  @Test
  @DisplayName("should fall back to the list title when the page has none")
  void shouldFallBackToListTitle() {
    when(contentExtractor.extract("https://a.com")).thenReturn(content(""));
    stubSave();

    archiveImportService.run(items("https://a.com"), userId, NO_DELAYS);

    ArgumentCaptor<ArchiveRecord> captor = ArgumentCaptor.forClass(ArchiveRecord.class);
    verify(archiveRecordRepository).saveAndFlush(captor.capture());
    assertThat(captor.getValue().getTitle()).isEqualTo("Listed title");
    assertThat(captor.getValue().getTags()).containsExactly("news");
  }

  private void stubSave() {
    when(archiveRecordRepository.saveAndFlush(any()))
        .thenAnswer(
            invocation -> {
              ArchiveRecord archive = invocation.getArgument(0);
              archive.setId(UUID.randomUUID());
              return archive;
            });
  }

  private static ExtractedContent content(String title) {
    return new ExtractedContent(
        title, "A description", "<html></html>", null, "Body text", 2, 1, "fetch");
  }

  private static List<ImportItem> items(String... urls) {
    return Arrays.stream(urls)
        .map(url -> new ImportItem(url, "Listed title", List.of("news"), Instant.EPOCH, false))
        .toList();
  }
}
