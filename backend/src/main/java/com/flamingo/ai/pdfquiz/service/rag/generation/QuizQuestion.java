package com.flamingo.ai.pdfquiz.service.rag.generation;

import com.fasterxml.jackson.annotation.JsonProperty;
import java.util.List;

/**
 * One multiple-choice question.
 *
 * @param question question text
 * @param options answer options, normally four labelled {@code A)} to {@code D)}
 * @param correctAnswer the correct option
 * @param explanation why the answer is correct, may be {@code null}
 */
public record QuizQuestion(
    @JsonProperty("question") String question,
    @JsonProperty("options") List<String> options,
    @JsonProperty("correct_answer") String correctAnswer,
    @JsonProperty("explanation") String explanation) {

  public QuizQuestion {
    options = options == null ? List.of() : List.copyOf(options);
  }
}
