package com.flamingo.ai.pdfquiz.exception;

/** Exception thrown when a document has no chunk collection. */
public class CollectionNotFoundException extends RuntimeException {

  private final String documentId;

  public CollectionNotFoundException(String documentId) {
    super("PDF not found: " + documentId);
    this.documentId = documentId;
  }

  public String getDocumentId() {
    return documentId;
  }
}
