package com.flamingo.ai.pdfquiz.api.dto.response;

import com.fasterxml.jackson.annotation.JsonProperty;
import com.flamingo.ai.pdfquiz.domain.entity.Job;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/** Response DTO for a queued quiz generation. */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class QuizQueuedResponse {

  @JsonProperty("job_id")
  private String jobId;

  @JsonProperty("quiz_id")
  private String quizId;

  private String message;

  @JsonProperty("exam_id")
  private Long examId;

  private String status;

  public static QuizQueuedResponse fromJob(Job job, Long examId) {
    return QuizQueuedResponse.builder()
        .jobId(job.getId())
        .quizId(job.getTargetId())
        .message("Quiz generation queued for processing")
        .examId(examId)
        .status(job.getStatus().getValue())
        .build();
  }
}
