package com.scholary.textextractor.config;

import java.util.concurrent.Executor;
import java.util.concurrent.ThreadPoolExecutor;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.scheduling.concurrent.ThreadPoolTaskExecutor;

/**
 * Configuration for async task execution.
 *
 * <p>Extraction jobs run on a fixed pool of {@code extractor.asyncExecutorThreads} threads. Each
 * job is single-threaded; the pool size only limits how many directories are processed at once.
 *
 * <p>At most {@code extractor.asyncExecutorQueueSize} jobs wait for a thread. Beyond that the
 * executor aborts the submission with {@code TaskRejectedException}; the controller drops the job
 * and answers 503 instead of leaving it pending forever.
 *
 * <p>On shutdown, running jobs are given {@value #SHUTDOWN_GRACE_SECONDS} seconds to finish so a
 * persist in progress is not cut off.
 */
@Configuration
public class AsyncConfig {

  static final int SHUTDOWN_GRACE_SECONDS = 30;

  @Bean(name = "taskExecutor")
  public Executor taskExecutor(
      @Value("${extractor.asyncExecutorThreads}") int threads,
      @Value("${extractor.asyncExecutorQueueSize}") int queueSize) {

    ThreadPoolTaskExecutor executor = new ThreadPoolTaskExecutor();
    executor.setCorePoolSize(threads);
    executor.setMaxPoolSize(threads);
    executor.setQueueCapacity(queueSize);
    executor.setRejectedExecutionHandler(new ThreadPoolExecutor.AbortPolicy());
    executor.setWaitForTasksToCompleteOnShutdown(true);
    executor.setAwaitTerminationSeconds(SHUTDOWN_GRACE_SECONDS);
    executor.setThreadNamePrefix("extraction-");
    executor.initialize();
    return executor;
  }
}
