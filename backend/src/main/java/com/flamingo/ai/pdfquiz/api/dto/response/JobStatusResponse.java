package com.flamingo.ai.pdfquiz.api.dto.response;

import com.fasterxml.jackson.annotation.JsonProperty;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.flamingo.ai.pdfquiz.domain.entity.Job;
import com.flamingo.ai.pdfquiz.domain.enums.JobKind;
import java.time.Instant;
import java.util.LinkedHashMap;
import java.util.Map;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/** Response DTO for a job status query. */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class JobStatusResponse {

  @JsonProperty("job_id")
  private String jobId;

  /** Queue the job belongs to. */
  private String queue;

  private String status;

  @JsonProperty("created_at")
  private Instant createdAt;

  @JsonProperty("started_at")
  private Instant startedAt;

  @JsonProperty("ended_at")
  private Instant endedAt;

  private JsonNode result;

  private String error;

  private Map<String, Object> meta;

  /** Creates a response from an entity; a stored result that is not JSON is returned as text. */
  public static JobStatusResponse fromEntity(Job job, ObjectMapper objectMapper) {
    Map<String, Object> meta = new LinkedHashMap<>();
    if (job.getKind() == JobKind.INGEST) {
      meta.put("upload_id", job.getCorrelationId());
      meta.put("pdf_id", job.getTargetId());
    } else {
      meta.put("exam_id", job.getCorrelationId());
      meta.put("quiz_id", job.getTargetId());
    }
    return JobStatusResponse.builder()
        .jobId(job.getId())
        .queue(job.getKind().getQueueName())
        .status(job.getStatus().getValue())
        .createdAt(job.getCreatedAt())
        .startedAt(job.getStartedAt())
        .endedAt(job.getEndedAt())
        .result(readResult(job.getResult(), objectMapper))
        .error(job.getError())
        .meta(meta)
        .build();
  }

  private static JsonNode readResult(String result, ObjectMapper objectMapper) {
    if (result == null) {
      return null;
    }
    try {
      return objectMapper.readTree(result);
    } catch (JsonProcessingException e) {
      return objectMapper.getNodeFactory().textNode(result);
    }
  }
}
