package com.flamingo.ai.pdfquiz.exception;

/** Exception raised for one failed webhook delivery attempt. */
public class DeliveryException extends RuntimeException {

  private final int statusCode;

  public DeliveryException(String message, int statusCode) {
    super(message);
    this.statusCode = statusCode;
  }

  public DeliveryException(String message, Throwable cause) {
    super(message, cause);
    this.statusCode = -1;
  }

  /** HTTP status of the rejected attempt, or -1 when no response arrived. */
  public int getStatusCode() {
    return statusCode;
  }
}
