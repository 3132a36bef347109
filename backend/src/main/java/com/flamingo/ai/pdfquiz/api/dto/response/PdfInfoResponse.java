package com.flamingo.ai.pdfquiz.api.dto.response;

import com.fasterxml.jackson.annotation.JsonProperty;
import com.flamingo.ai.pdfquiz.elasticsearch.CollectionInfo;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/** Response DTO describing one indexed PDF. */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class PdfInfoResponse {

  @JsonProperty("pdf_id")
  private String pdfId;

  @JsonProperty("chunk_count")
  private long chunkCount;

  @JsonProperty("pdf_name")
  private String pdfName;

  @JsonProperty("total_pages")
  private Integer totalPages;

  public static PdfInfoResponse fromInfo(CollectionInfo info) {
    return PdfInfoResponse.builder()
        .pdfId(info.documentId())
        .chunkCount(info.chunkCount())
        .pdfName(info.documentName())
        .totalPages(info.totalPages())
        .build();
  }
}
