package com.flamingo.ai.pdfquiz.service.job;

import com.fasterxml.jackson.annotation.JsonProperty;

/** Result stored on a finished ingestion job. */
public record IngestResult(
    @JsonProperty("pdf_id") String pdfId,
    @JsonProperty("upload_id") Long uploadId,
    @JsonProperty("total_pages") int totalPages,
    @JsonProperty("pdf_name") String pdfName,
    @JsonProperty("chunk_count") int chunkCount,
    @JsonProperty("status") String status,
    @JsonProperty("message") String message) {

  public static IngestResult success(
      String pdfId, Long uploadId, int totalPages, String pdfName, int chunkCount) {
    return new IngestResult(
        pdfId, uploadId, totalPages, pdfName, chunkCount, "success", "PDF processed successfully");
  }
}
