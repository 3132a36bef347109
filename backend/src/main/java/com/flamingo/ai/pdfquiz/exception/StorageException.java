package com.flamingo.ai.pdfquiz.exception;

/** Exception thrown when the vector store or the embedding backend fails. */
public class StorageException extends RuntimeException {

  private final String userMessage;

  public StorageException(String message, Throwable cause) {
    super(message, cause);
    this.userMessage = "Document storage is temporarily unavailable. Please try again later.";
  }

  public String getUserMessage() {
    return userMessage;
  }
}
