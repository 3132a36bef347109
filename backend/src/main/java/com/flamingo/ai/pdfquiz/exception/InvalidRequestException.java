package com.flamingo.ai.pdfquiz.exception;

/** Exception thrown when a request is well-formed JSON but semantically invalid. */
public class InvalidRequestException extends RuntimeException {

  public InvalidRequestException(String message) {
    super(message);
  }
}
