package com.flamingo.ai.webarchive.config;

import static org.assertj.core.api.Assertions.assertThat;

import java.util.concurrent.CountDownLatch;
import java.util.concurrent.TimeUnit;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.springframework.scheduling.concurrent.ThreadPoolTaskExecutor;

class AsyncConfigTest {

  @Test
  @DisplayName("should run a full batch of items at once")
  void shouldRunFullBatchConcurrently() throws InterruptedException {
    ArchiveConfig archiveConfig = new ArchiveConfig();
    archiveConfig.getImporting().setMaxBatchSize(12);
    archiveConfig.getImporting().setMaxConcurrentJobs(2);
    ThreadPoolTaskExecutor executor = new AsyncConfig().importItemExecutor(archiveConfig);

    CountDownLatch started = new CountDownLatch(12);
    CountDownLatch release = new CountDownLatch(1);
    try {
      for (int i = 0; i < 12; i++) {
        executor.execute(
            () -> {
              started.countDown();
              try {
                release.await(5, TimeUnit.SECONDS);
              } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
              }
            });
      }

      assertThat(started.await(5, TimeUnit.SECONDS)).isTrue();
    } finally {
      release.countDown();
      executor.shutdown();
    }
  }

  @Test
  @DisplayName("should keep one worker per running job")
  void shouldSizeJobPoolByConcurrentJobs() {
    ArchiveConfig archiveConfig = new ArchiveConfig();
    archiveConfig.getImporting().setMaxConcurrentJobs(3);
    ThreadPoolTaskExecutor executor = new AsyncConfig().importJobExecutor(archiveConfig);

    try {
      assertThat(executor.getCorePoolSize()).isEqualTo(3);
      assertThat(executor.getMaxPoolSize()).isEqualTo(3);
    } finally {
      executor.shutdown();
    }
  }
}
