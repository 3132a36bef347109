package com.flamingo.ai.pdfquiz.exception;

import java.time.Instant;
import lombok.Builder;
import lombok.Getter;

/** Structured API error response. */
@Getter
@Builder
public class ApiError {

  // Error codes
  public static final String PDF_NOT_FOUND = "PDF_001";
  public static final String PDF_PROCESSING_ERROR = "PDF_002";
  public static final String PAGE_RANGE_INVALID = "PDF_003";
  public static final String PAGE_RANGE_EMPTY = "PDF_004";
  public static final String JOB_NOT_FOUND = "JOB_001";
  public static final String QUIZ_GENERATION_FAILED = "QUIZ_001";
  public static final String LLM_UNAVAILABLE = "LLM_001";
  public static final String STORAGE_UNAVAILABLE = "STORAGE_001";
  public static final String VALIDATION_ERROR = "VALIDATION_001";
  public static final String INTERNAL_ERROR = "INTERNAL_001";

  /** Unique error ID for log correlation. */
  private final String errorId;

  /** Machine-readable error code. */
  private final String code;

  /** User-friendly error message. */
  private final String message;

  private final Instant timestamp;

  /** Request path that caused the error. */
  private final String path;
}
