package com.flamingo.ai.pdfquiz.service.job;

import com.fasterxml.jackson.annotation.JsonProperty;
import com.flamingo.ai.pdfquiz.service.rag.generation.QuizQuestion;
import com.flamingo.ai.pdfquiz.service.rag.generation.QuizSpec;
import java.util.List;

/** Result stored on a finished quiz job and sent to the quiz webhook. */
public record QuizResult(
    @JsonProperty("quiz_id") String quizId,
    @JsonProperty("questions") List<QuizQuestion> questions,
    @JsonProperty("metadata") Metadata metadata,
    @JsonProperty("message") String message) {

  public QuizResult {
    questions = List.copyOf(questions);
  }

  public static QuizResult of(String quizId, QuizSpec spec, List<QuizQuestion> questions) {
    return new QuizResult(
        quizId,
        questions,
        new Metadata(
            spec.mode().getValue(),
            questions.size(),
            spec.difficulty().getValue(),
            spec.topic(),
            spec.documentIds().size()),
        "Quiz generated successfully");
  }

  /** Summary of how the quiz was produced. */
  public record Metadata(
      @JsonProperty("quiz_type") String quizType,
      @JsonProperty("num_questions") int numQuestions,
      @JsonProperty("difficulty") String difficulty,
      @JsonProperty("topic") String topic,
      @JsonProperty("pdf_count") int pdfCount) {}
}
