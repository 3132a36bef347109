package com.flamingo.ai.pdfquiz.exception;

/** Exception thrown when no page of a PDF yields text. */
public class ExtractionException extends DocumentProcessingException {

  public ExtractionException(String message) {
    super(null, message);
  }

  public ExtractionException(String message, Throwable cause) {
    super(null, message, cause);
  }
}
