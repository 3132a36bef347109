package com.flamingo.ai.pdfquiz.elasticsearch;

import java.util.List;
import java.util.Map;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * A chunk as stored in, and read back from, a document's collection.
 *
 * <p>{@code pageNumber} is only set for chunks written with the current metadata layout; {@code
 * pages} is the legacy comma-separated page list. {@code metadata} keeps the raw stored fields so
 * page resolution can tolerate values of unexpected type.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class DocumentChunk {

  private String id;
  private String documentId;
  private String chunkId;
  private String content;
  private String documentName;
  private Integer totalPages;
  private Integer chunkIndexOnPage;
  private Integer pageNumber;
  private String pages;
  private List<Float> embedding;

  @Builder.Default private Double relevanceScore = 0.0;

  @Builder.Default private Map<String, Object> metadata = Map.of();
}
