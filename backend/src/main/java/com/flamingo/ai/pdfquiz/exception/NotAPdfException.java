package com.flamingo.ai.pdfquiz.exception;

/** Exception thrown when a downloaded body is neither typed nor shaped like a PDF. */
public class NotAPdfException extends DocumentProcessingException {

  private final String sourceUrl;

  public NotAPdfException(String sourceUrl, String contentType) {
    super(null, "URL does not point to a valid PDF file (content type: " + contentType + ")");
    this.sourceUrl = sourceUrl;
  }

  public String getSourceUrl() {
    return sourceUrl;
  }
}
