package com.flamingo.ai.pdfquiz.exception;

import io.micrometer.core.instrument.MeterRegistry;
import jakarta.servlet.http.HttpServletRequest;
import java.time.Instant;
import java.util.UUID;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.http.converter.HttpMessageNotReadableException;
import org.springframework.web.bind.MethodArgumentNotValidException;
import org.springframework.web.bind.annotation.ExceptionHandler;
import org.springframework.web.bind.annotation.RestControllerAdvice;

/** Global exception handler for REST controllers. */
@RestControllerAdvice
@RequiredArgsConstructor
@Slf4j
public class GlobalExceptionHandler {

  private final MeterRegistry meterRegistry;

  @ExceptionHandler(CollectionNotFoundException.class)
  public ResponseEntity<ApiError> handleCollectionNotFound(
      CollectionNotFoundException ex, HttpServletRequest request) {
    String errorId = register("pdf_not_found");
    log.warn("PDF not found [{}]: {}", errorId, ex.getDocumentId());
    return respond(HttpStatus.NOT_FOUND, errorId, ApiError.PDF_NOT_FOUND, ex.getMessage(), request);
  }

  @ExceptionHandler(JobNotFoundException.class)
  public ResponseEntity<ApiError> handleJobNotFound(
      JobNotFoundException ex, HttpServletRequest request) {
    String errorId = register("job_not_found");
    log.warn("Job not found [{}]: {}", errorId, ex.getJobId());
    return respond(HttpStatus.NOT_FOUND, errorId, ApiError.JOB_NOT_FOUND, ex.getMessage(), request);
  }

  @ExceptionHandler(NoContentInRangeException.class)
  public ResponseEntity<ApiError> handleNoContentInRange(
      NoContentInRangeException ex, HttpServletRequest request) {
    String errorId = register("no_content_in_range");
    log.warn("No content in range [{}]: pdf={} {}", errorId, ex.getDocumentId(), ex.getMessage());
    return respond(
        HttpStatus.NOT_FOUND, errorId, ApiError.PAGE_RANGE_EMPTY, ex.getMessage(), request);
  }

  @ExceptionHandler(InvalidPageRangeException.class)
  public ResponseEntity<ApiError> handleInvalidPageRange(
      InvalidPageRangeException ex, HttpServletRequest request) {
    String errorId = register("invalid_page_range");
    log.warn("Invalid page range [{}]: {}-{}", errorId, ex.getPageStart(), ex.getPageEnd());
    return respond(
        HttpStatus.BAD_REQUEST, errorId, ApiError.PAGE_RANGE_INVALID, ex.getMessage(), request);
  }

  @ExceptionHandler(InvalidRequestException.class)
  public ResponseEntity<ApiError> handleInvalidRequest(
      InvalidRequestException ex, HttpServletRequest request) {
    String errorId = register("validation_error");
    log.warn("Invalid request [{}]: {}", errorId, ex.getMessage());
    return respond(
        HttpStatus.BAD_REQUEST, errorId, ApiError.VALIDATION_ERROR, ex.getMessage(), request);
  }

  @ExceptionHandler(MethodArgumentNotValidException.class)
  public ResponseEntity<ApiError> handleValidation(
      MethodArgumentNotValidException ex, HttpServletRequest request) {
    String errorId = register("validation_error");
    String message =
        ex.getBindingResult().getFieldErrors().stream()
            .findFirst()
            .map(error -> error.getField() + ": " + error.getDefaultMessage())
            .orElse("Validation failed");
    log.warn("Validation error [{}]: {}", errorId, message);
    return respond(HttpStatus.BAD_REQUEST, errorId, ApiError.VALIDATION_ERROR, message, request);
  }

  @ExceptionHandler(HttpMessageNotReadableException.class)
  public ResponseEntity<ApiError> handleUnreadable(
      HttpMessageNotReadableException ex, HttpServletRequest request) {
    String errorId = register("validation_error");
    log.warn("Unreadable request body [{}]: {}", errorId, ex.getMessage());
    return respond(
        HttpStatus.BAD_REQUEST,
        errorId,
        ApiError.VALIDATION_ERROR,
        "Malformed request body",
        request);
  }

  @ExceptionHandler(DocumentProcessingException.class)
  public ResponseEntity<ApiError> handleDocumentProcessing(
      DocumentProcessingException ex, HttpServletRequest request) {
    String errorId = register("pdf_processing");
    log.error("PDF processing error [{}]: {}", errorId, ex.getMessage(), ex);
    return respond(
        HttpStatus.UNPROCESSABLE_ENTITY,
        errorId,
        ApiError.PDF_PROCESSING_ERROR,
        ex.getUserMessage(),
        request);
  }

  @ExceptionHandler(StorageException.class)
  public ResponseEntity<ApiError> handleStorage(StorageException ex, HttpServletRequest request) {
    String errorId = register("storage_error");
    log.error("Storage error [{}]: {}", errorId, ex.getMessage(), ex);
    return respond(
        HttpStatus.SERVICE_UNAVAILABLE,
        errorId,
        ApiError.STORAGE_UNAVAILABLE,
        ex.getUserMessage(),
        request);
  }

  @ExceptionHandler(QuizGenerationException.class)
  public ResponseEntity<ApiError> handleQuizGeneration(
      QuizGenerationException ex, HttpServletRequest request) {
    String errorId = register("quiz_generation");
    log.error("Quiz generation error [{}]: {}", errorId, ex.getMessage(), ex);
    return respond(
        HttpStatus.SERVICE_UNAVAILABLE,
        errorId,
        ApiError.QUIZ_GENERATION_FAILED,
        ex.getMessage(),
        request);
  }

  @ExceptionHandler(LlmServiceException.class)
  public ResponseEntity<ApiError> handleLlmService(
      LlmServiceException ex, HttpServletRequest request) {
    String errorId = register("llm_service");
    log.error("LLM service error [{}]: {}", errorId, ex.getMessage(), ex);
    return respond(
        HttpStatus.SERVICE_UNAVAILABLE,
        errorId,
        ApiError.LLM_UNAVAILABLE,
        ex.getUserMessage(),
        request);
  }

  @ExceptionHandler(Exception.class)
  public ResponseEntity<ApiError> handleGeneric(Exception ex, HttpServletRequest request) {
    String errorId = register("internal_error");
    log.error("Unexpected error [{}]: {}", errorId, ex.getMessage(), ex);
    return respond(
        HttpStatus.INTERNAL_SERVER_ERROR,
        errorId,
        ApiError.INTERNAL_ERROR,
        "An unexpected error occurred. Please try again later.",
        request);
  }

  private ResponseEntity<ApiError> respond(
      HttpStatus status,
      String errorId,
      String code,
      String message,
      HttpServletRequest request) {
    return ResponseEntity.status(status)
        .body(
            ApiError.builder()
                .errorId(errorId)
                .code(code)
                .message(message)
                .path(request.getRequestURI())
                .timestamp(Instant.now())
                .build());
  }

  private String register(String errorType) {
    meterRegistry.counter("api_errors_total", "error_type", errorType).increment();
    return UUID.randomUUID().toString().substring(0, 8);
  }
}
