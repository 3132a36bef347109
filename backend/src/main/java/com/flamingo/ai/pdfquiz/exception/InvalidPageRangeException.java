package com.flamingo.ai.pdfquiz.exception;

/** Exception thrown when a page range starts below 1 or ends before it starts. */
public class InvalidPageRangeException extends InvalidRequestException {

  private final int pageStart;
  private final int pageEnd;

  public InvalidPageRangeException(int pageStart, int pageEnd) {
    super("Invalid page range: " + pageStart + "-" + pageEnd);
    this.pageStart = pageStart;
    this.pageEnd = pageEnd;
  }

  public int getPageStart() {
    return pageStart;
  }

  public int getPageEnd() {
    return pageEnd;
  }
}
