package com.flamingo.ai.pdfquiz.config;

import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.scheduling.concurrent.ThreadPoolTaskExecutor;

/** Worker pools, one per job kind, and the webhook delivery pool. */
@Configuration
public class AsyncConfig {

  @Bean(name = "ingestExecutor")
  public ThreadPoolTaskExecutor ingestExecutor() {
    ThreadPoolTaskExecutor executor = new ThreadPoolTaskExecutor();
    executor.setCorePoolSize(2);
    executor.setMaxPoolSize(2);
    executor.setQueueCapacity(0);
    executor.setThreadNamePrefix("pdf-ingest-");
    executor.initialize();
    return executor;
  }

  @Bean(name = "quizExecutor")
  public ThreadPoolTaskExecutor quizExecutor() {
    ThreadPoolTaskExecutor executor = new ThreadPoolTaskExecutor();
    executor.setCorePoolSize(4);
    executor.setMaxPoolSize(4);
    executor.setQueueCapacity(0);
    executor.setThreadNamePrefix("quiz-gen-");
    executor.initialize();
    return executor;
  }

  /** Webhook deliveries. One delivery with its retries can hold a thread for minutes. */
  @Bean(name = "webhookExecutor")
  public ThreadPoolTaskExecutor webhookExecutor() {
    ThreadPoolTaskExecutor executor = new ThreadPoolTaskExecutor();
    executor.setCorePoolSize(4);
    executor.setMaxPoolSize(4);
    executor.setQueueCapacity(0);
    executor.setThreadNamePrefix("webhook-");
    executor.initialize();
    return executor;
  }
}
