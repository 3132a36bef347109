package com.flamingo.ai.pdfquiz.api.dto.response;

import com.fasterxml.jackson.annotation.JsonProperty;
import com.flamingo.ai.pdfquiz.domain.entity.Job;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/** Response DTO for a queued ingestion. */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class PdfUploadQueuedResponse {

  @JsonProperty("job_id")
  private String jobId;

  @JsonProperty("pdf_id")
  private String pdfId;

  private String message;

  @JsonProperty("upload_id")
  private Long uploadId;

  private String status;

  public static PdfUploadQueuedResponse fromJob(Job job, Long uploadId) {
    return PdfUploadQueuedResponse.builder()
        .jobId(job.getId())
        .pdfId(job.getTargetId())
        .message("PDF upload queued for processing")
        .uploadId(uploadId)
        .status(job.getStatus().getValue())
        .build();
  }
}
