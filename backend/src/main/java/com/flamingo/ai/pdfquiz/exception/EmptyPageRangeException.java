package com.flamingo.ai.pdfquiz.exception;

/** Exception thrown when a valid page range selects no extracted pages. */
public class EmptyPageRangeException extends InvalidRequestException {

  public EmptyPageRangeException(int pageStart, int pageEnd) {
    super("No content found in page range " + pageStart + "-" + pageEnd);
  }
}
