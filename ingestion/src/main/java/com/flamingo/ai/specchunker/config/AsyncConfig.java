package com.flamingo.ai.specchunker.config;

import java.util.concurrent.Executor;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.scheduling.concurrent.ThreadPoolTaskExecutor;

/** Configuration for the page extraction look-ahead pool. */
@Configuration
public class AsyncConfig {

  @Bean(name = "pageExtractionExecutor")
  public Executor pageExtractionExecutor(IngestionConfig ingestionConfig) {
    int workers = Math.max(1, ingestionConfig.getExtraction().getWorkerThreads());
    ThreadPoolTaskExecutor executor = new ThreadPoolTaskExecutor();
    executor.setCorePoolSize(workers);
    executor.setMaxPoolSize(workers);
    executor.setQueueCapacity(Math.max(1, ingestionConfig.getExtraction().getPrefetchDepth()) * 2);
    executor.setThreadNamePrefix("page-extract-");
    executor.setWaitForTasksToCompleteOnShutdown(false);
    executor.initialize();
    return executor;
  }
}
