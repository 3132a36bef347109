package com.flamingo.ai.pdfquiz.service.job;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonIgnore;
import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;

/**
 * Payload of an ingestion job.
 *
 * @param sourceUrl where to download the PDF from
 * @param uploadId caller's upload handle, echoed in the webhook
 * @param pdfName display name, may be {@code null}
 * @param pdfId id assigned at enqueue time
 * @param pageStart first page to index, {@code null} for the whole document
 * @param pageEnd last page to index, {@code null} for the whole document
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
public record IngestRequest(
    @JsonProperty("source_url") String sourceUrl,
    @JsonProperty("upload_id") Long uploadId,
    @JsonProperty("pdf_name") String pdfName,
    @JsonProperty("pdf_id") String pdfId,
    @JsonProperty("page_start") Integer pageStart,
    @JsonProperty("page_end") Integer pageEnd) {

  @JsonCreator
  public IngestRequest {}

  public IngestRequest(String sourceUrl, Long uploadId, String pdfName, String pdfId) {
    this(sourceUrl, uploadId, pdfName, pdfId, null, null);
  }

  @JsonIgnore
  public boolean hasPageRange() {
    return pageStart != null && pageEnd != null;
  }
}
