package com.flamingo.ai.foodscout.config;

import java.util.concurrent.Executor;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.scheduling.annotation.EnableAsync;
import org.springframework.scheduling.annotation.EnableScheduling;
import org.springframework.scheduling.concurrent.ThreadPoolTaskExecutor;

/** Executors for background turns and per-document analysis. */
@Configuration
@EnableAsync
@EnableScheduling
public class AsyncConfig {

  /** One task per active turn; a session never has two running at once. */
  @Bean(name = "searchExecutor")
  public ThreadPoolTaskExecutor searchExecutor(ScoutConfig scoutConfig) {
    ThreadPoolTaskExecutor executor = new ThreadPoolTaskExecutor();
    executor.setCorePoolSize(scoutConfig.getSearch().getSearchThreads());
    executor.setMaxPoolSize(scoutConfig.getSearch().getSearchThreads() * 2);
    executor.setQueueCapacity(100);
    executor.setThreadNamePrefix("search-");
    executor.initialize();
    return executor;
  }

  @Bean(name = "analysisExecutor")
  public Executor analysisExecutor(ScoutConfig scoutConfig) {
    ThreadPoolTaskExecutor executor = new ThreadPoolTaskExecutor();
    executor.setCorePoolSize(scoutConfig.getSearch().getAnalysisThreads());
    executor.setMaxPoolSize(scoutConfig.getSearch().getAnalysisThreads());
    executor.setQueueCapacity(200);
    executor.setThreadNamePrefix("analysis-");
    executor.initialize();
    return executor;
  }
}
