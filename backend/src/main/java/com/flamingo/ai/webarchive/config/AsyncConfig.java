package com.flamingo.ai.webarchive.config;

import java.util.concurrent.ThreadPoolExecutor;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.scheduling.concurrent.ThreadPoolTaskExecutor;

/** Configuration for import executors. */
@Configuration
public class AsyncConfig {

  /** Runs whole import jobs; one thread per running job. */
  @Bean(name = "importJobExecutor")
  public ThreadPoolTaskExecutor importJobExecutor(ArchiveConfig archiveConfig) {
    int jobs = archiveConfig.getImporting().getMaxConcurrentJobs();
    ThreadPoolTaskExecutor executor = new ThreadPoolTaskExecutor();
    executor.setCorePoolSize(jobs);
    executor.setMaxPoolSize(jobs);
    executor.setQueueCapacity(50);
    executor.setThreadNamePrefix("import-job-");
    executor.setWaitForTasksToCompleteOnShutdown(true);
    executor.setAwaitTerminationSeconds(120);
    executor.initialize();
    return executor;
  }

  /**
   * Runs the items of one import batch concurrently. Items are handed straight to a thread, never
   * queued, so a batch of n items runs n extractions at once; the pool holds a full batch for
   * every job that can run.
   */
  @Bean(name = "importItemExecutor")
  public ThreadPoolTaskExecutor importItemExecutor(ArchiveConfig archiveConfig) {
    ArchiveConfig.Importing importing = archiveConfig.getImporting();
    ThreadPoolTaskExecutor executor = new ThreadPoolTaskExecutor();
    executor.setCorePoolSize(importing.getMaxBatchSize());
    executor.setMaxPoolSize(importing.getMaxBatchSize() * importing.getMaxConcurrentJobs());
    executor.setQueueCapacity(0);
    executor.setThreadNamePrefix("import-item-");
    executor.setRejectedExecutionHandler(new ThreadPoolExecutor.CallerRunsPolicy());
    executor.setWaitForTasksToCompleteOnShutdown(true);
    executor.setAwaitTerminationSeconds(120);
    executor.initialize();
    return executor;
  }
}
