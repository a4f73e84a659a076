package com.flamingo.ai.companybrain.config;

import lombok.RequiredArgsConstructor;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.scheduling.concurrent.ThreadPoolTaskExecutor;

/** Executors for sub-query fan-out and for time-limited collaborator calls. */
@Configuration
@RequiredArgsConstructor
public class AsyncConfig {

  private final RagConfig ragConfig;

  /**
   * Runs the sub-queries of a question. Sized to the fan-out parallelism so one question never
   * holds more than that many concurrent search calls.
   */
  @Bean(name = "searchFanoutExecutor")
  public ThreadPoolTaskExecutor searchFanoutExecutor() {
    int parallelism = Math.max(1, ragConfig.getRetrieval().getFanoutParallelism());
    ThreadPoolTaskExecutor executor = new ThreadPoolTaskExecutor();
    executor.setCorePoolSize(parallelism);
    executor.setMaxPoolSize(parallelism);
    executor.setQueueCapacity(100);
    executor.setThreadNamePrefix("search-fanout-");
    executor.initialize();
    return executor;
  }

  /**
   * Runs the blocking embedding, search and generation calls so a caller can stop waiting when the
   * call's timeout expires.
   */
  @Bean(name = "collaboratorCallExecutor")
  public ThreadPoolTaskExecutor collaboratorCallExecutor() {
    ThreadPoolTaskExecutor executor = new ThreadPoolTaskExecutor();
    executor.setCorePoolSize(8);
    executor.setMaxPoolSize(32);
    executor.setQueueCapacity(200);
    executor.setThreadNamePrefix("collab-call-");
    executor.setWaitForTasksToCompleteOnShutdown(true);
    executor.setAwaitTerminationSeconds(30);
    executor.initialize();
    return executor;
  }
}
