package com.flamingo.ai.pdfquiz.service.rag.generation;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;

/** The three ways a quiz selects its source content. */
public enum QuizMode {
  TOPIC("topic"),
  PAGE_RANGE("page_range"),
  MULTI_PDF_TOPIC("multi_pdf_topic");

  private final String value;

  QuizMode(String value) {
    this.value = value;
  }

  @JsonValue
  public String getValue() {
    return value;
  }

  @JsonCreator
  public static QuizMode fromValue(String value) {
    for (QuizMode mode : values()) {
      if (mode.value.equalsIgnoreCase(value)) {
        return mode;
      }
    }
    throw new IllegalArgumentException("Unknown quiz type: " + value);
  }

  /** Whether the mode needs a topic to search for. */
  public boolean requiresTopic() {
    return this != PAGE_RANGE;
  }
}
