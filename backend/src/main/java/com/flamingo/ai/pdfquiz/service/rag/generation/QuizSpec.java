package com.flamingo.ai.pdfquiz.service.rag.generation;

import com.fasterxml.jackson.annotation.JsonProperty;
import java.util.List;

/**
 * What to generate a quiz from. {@code topic} applies to topic modes, the page bounds to {@link
 * QuizMode#PAGE_RANGE}; the single-document modes use the first document only.
 */
public record QuizSpec(
    @JsonProperty("quiz_type") QuizMode mode,
    @JsonProperty("pdf_ids") List<String> documentIds,
    @JsonProperty("topic") String topic,
    @JsonProperty("page_start") Integer pageStart,
    @JsonProperty("page_end") Integer pageEnd,
    @JsonProperty("num_questions") int numQuestions,
    @JsonProperty("difficulty") Difficulty difficulty) {

  public QuizSpec {
    documentIds = documentIds == null ? List.of() : List.copyOf(documentIds);
  }

  public String primaryDocumentId() {
    return documentIds.get(0);
  }
}
