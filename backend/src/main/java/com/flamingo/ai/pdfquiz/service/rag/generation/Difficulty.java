package com.flamingo.ai.pdfquiz.service.rag.generation;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;
import java.util.Locale;

/** Quiz difficulty. */
public enum Difficulty {
  EASY,
  MEDIUM,
  HARD;

  @JsonValue
  public String getValue() {
    return name().toLowerCase(Locale.ROOT);
  }

  @JsonCreator
  public static Difficulty fromValue(String value) {
    for (Difficulty difficulty : values()) {
      if (difficulty.name().equalsIgnoreCase(value)) {
        return difficulty;
      }
    }
    throw new IllegalArgumentException("Unknown difficulty: " + value);
  }
}
