package com.flamingo.ai.pdfquiz.exception;

/** Exception thrown when the completion service fails to answer. */
public class LlmServiceException extends RuntimeException {

  private final String userMessage;

  public LlmServiceException(String message, Throwable cause) {
    super(message, cause);
    this.userMessage = "AI service is temporarily unavailable. Please try again later.";
  }

  public String getUserMessage() {
    return userMessage;
  }
}
