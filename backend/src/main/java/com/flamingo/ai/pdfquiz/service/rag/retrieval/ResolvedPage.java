package com.flamingo.ai.pdfquiz.service.rag.retrieval;

/**
 * A chunk's page number together with the metadata field it was read from.
 *
 * @param page 1-based page number
 * @param source which metadata layout supplied it
 */
public record ResolvedPage(int page, PageSource source) {

  /** Metadata layouts, in the order they are consulted. */
  public enum PageSource {
    /** Single integer {@code page_number}. */
    CURRENT,
    /** First entry of the comma-separated {@code pages} string. */
    LEGACY
  }
}
