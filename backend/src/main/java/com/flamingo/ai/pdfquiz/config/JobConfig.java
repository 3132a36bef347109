package com.flamingo.ai.pdfquiz.config;

import lombok.Getter;
import lombok.Setter;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.context.annotation.Configuration;

/** Configuration properties for background jobs and completion webhooks. */
@Configuration
@ConfigurationProperties(prefix = "jobs")
@Getter
@Setter
public class JobConfig {

  private long pollIntervalMs = 1000;
  private int timeoutMinutes = 30;
  private long reaperIntervalMs = 60000;

  /** Maximum jobs claimed per kind on one poll. */
  private int claimBatchSize = 4;

  private Webhook webhook = new Webhook();

  @Getter
  @Setter
  public static class Webhook {
    private String baseUrl = "http://localhost:8000";
    private String uploadPath = "/webhook/upload-processed/{id}";
    private String quizPath = "/webhook/quiz-generated/{id}";
    private int timeoutSeconds = 30;
    private int maxAttempts = 3;
    private long initialBackoffMs = 1000;
    private double backoffMultiplier = 2.0;
    private long dispatchIntervalMs = 2000;
    private int dispatchBatchSize = 20;
  }
}
