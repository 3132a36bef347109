package com.flamingo.ai.pdfquiz.config;

import lombok.Getter;
import lombok.Setter;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.context.annotation.Configuration;

/** Configuration properties for the ingestion, retrieval and generation pipeline. */
@Configuration
@ConfigurationProperties(prefix = "rag")
@Getter
@Setter
public class RagConfig {

  private Chunking chunking = new Chunking();
  private Ingestion ingestion = new Ingestion();
  private Retrieval retrieval = new Retrieval();
  private Chat chat = new Chat();
  private Quiz quiz = new Quiz();

  @Getter
  @Setter
  public static class Chunking {
    private int size = 1000;
    private int overlap = 200;
  }

  @Getter
  @Setter
  public static class Ingestion {
    /** Chunks embedded and bulk-inserted per request. */
    private int batchSize = 10;

    private int downloadTimeoutSeconds = 30;
    private int maxDownloadBytes = 50 * 1024 * 1024;

    /** Page metadata layout written for new chunks. */
    private MetadataSchema metadataSchema = MetadataSchema.CURRENT;
  }

  @Getter
  @Setter
  public static class Retrieval {
    private int chatSingleTopK = 4;
    private int chatMultiTopK = 8;
    private int quizTopicTopK = 8;
    private int quizMultiTopK = 12;
  }

  @Getter
  @Setter
  public static class Chat {
    private int historyTurns = 5;
  }

  @Getter
  @Setter
  public static class Quiz {
    private int maxQuestions = 20;
    private int defaultQuestions = 5;
  }

  /** Page metadata layouts a collection may contain. */
  public enum MetadataSchema {
    /** Single integer {@code page_number} plus the legacy page list. */
    CURRENT,
    /** Comma-separated {@code pages} string only. */
    LEGACY
  }
}
