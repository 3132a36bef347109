package com.flamingo.ai.pdfquiz.exception;

/** Exception thrown when no stored chunk of a document falls inside a page range. */
public class NoContentInRangeException extends RuntimeException {

  private final String documentId;

  public NoContentInRangeException(String documentId, int pageStart, int pageEnd) {
    super("No content found in pages " + pageStart + "-" + pageEnd);
    this.documentId = documentId;
  }

  public String getDocumentId() {
    return documentId;
  }
}
