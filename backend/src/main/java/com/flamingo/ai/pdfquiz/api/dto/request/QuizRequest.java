package com.flamingo.ai.pdfquiz.api.dto.request;

import com.fasterxml.jackson.annotation.JsonProperty;
import com.flamingo.ai.pdfquiz.service.rag.generation.Difficulty;
import com.flamingo.ai.pdfquiz.service.rag.generation.QuizMode;
import jakarta.validation.constraints.NotNull;
import java.util.List;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * Request DTO for queueing a quiz. Mode-dependent rules (topic, page bounds, question count) are
 * checked when the quiz is submitted.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class QuizRequest {

  @NotNull(message = "Quiz type is required")
  @JsonProperty("quiz_type")
  private QuizMode quizType;

  @JsonProperty("pdf_ids")
  private List<String> pdfIds;

  private String topic;

  @JsonProperty("page_start")
  private Integer pageStart;

  @JsonProperty("page_end")
  private Integer pageEnd;

  /** Defaults to five questions. */
  @JsonProperty("num_questions")
  private Integer numQuestions;

  /** Defaults to medium. */
  private Difficulty difficulty;

  @JsonProperty("exam_id")
  private Long examId;
}
