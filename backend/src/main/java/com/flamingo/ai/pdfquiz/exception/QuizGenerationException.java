package com.flamingo.ai.pdfquiz.exception;

/** Exception thrown when a quiz cannot be generated from the retrieved content. */
public class QuizGenerationException extends RuntimeException {

  public QuizGenerationException(String message) {
    super(message);
  }

  public QuizGenerationException(String message, Throwable cause) {
    super(message, cause);
  }
}
