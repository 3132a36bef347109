package com.flamingo.ai.pdfquiz.api.dto.request;

import com.fasterxml.jackson.annotation.JsonAlias;
import com.fasterxml.jackson.annotation.JsonProperty;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotNull;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/** Request DTO for queueing a PDF for ingestion. */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class PdfUploadRequest {

  @NotBlank(message = "Source URL is required")
  @JsonProperty("uploadthing_url")
  @JsonAlias("source_url")
  private String sourceUrl;

  @NotNull(message = "Upload id is required")
  @JsonProperty("upload_id")
  private Long uploadId;

  @JsonProperty("pdf_name")
  private String pdfName;

  /** Optional first page to index; requires {@link #pageEnd}. */
  @JsonProperty("page_start")
  private Integer pageStart;

  @JsonProperty("page_end")
  private Integer pageEnd;
}
