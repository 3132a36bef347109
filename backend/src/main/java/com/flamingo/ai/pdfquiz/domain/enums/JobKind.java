package com.flamingo.ai.pdfquiz.domain.enums;

/** Kind of deferred work; each kind has its own queue and worker pool. */
public enum JobKind {
  INGEST("pdf_processing"),
  GENERATE_QUIZ("quiz_processing");

  private final String queueName;

  JobKind(String queueName) {
    this.queueName = queueName;
  }

  public String getQueueName() {
    return queueName;
  }
}
