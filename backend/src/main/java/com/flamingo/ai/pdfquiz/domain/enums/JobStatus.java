package com.flamingo.ai.pdfquiz.domain.enums;

import com.fasterxml.jackson.annotation.JsonValue;
import java.util.Locale;

/** Lifecycle state of a job. */
public enum JobStatus {
  QUEUED,
  STARTED,
  FINISHED,
  FAILED,
  CANCELED;

  @JsonValue
  public String getValue() {
    return name().toLowerCase(Locale.ROOT);
  }

  public boolean isTerminal() {
    return this == FINISHED || this == FAILED || this == CANCELED;
  }
}
