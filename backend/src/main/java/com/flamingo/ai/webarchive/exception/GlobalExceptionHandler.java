package com.flamingo.ai.webarchive.exception;

import io.micrometer.core.instrument.MeterRegistry;
import jakarta.servlet.http.HttpServletRequest;
import java.time.Instant;
import java.util.UUID;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.MethodArgumentNotValidException;
import org.springframework.web.bind.annotation.ExceptionHandler;
import org.springframework.web.bind.annotation.RestControllerAdvice;

/** Maps service exceptions to {@link ApiError} responses. */
@RestControllerAdvice
@RequiredArgsConstructor
@Slf4j
public class GlobalExceptionHandler {

  private final MeterRegistry meterRegistry;

  @ExceptionHandler(ArchiveNotFoundException.class)
  public ResponseEntity<ApiError> handleArchiveNotFound(
      ArchiveNotFoundException ex, HttpServletRequest request) {
    String errorId = record("archive_not_found");
    log.warn("Archive not found [{}]: {}", errorId, ex.getArchiveId());
    return respond(
        HttpStatus.NOT_FOUND, errorId, ApiError.ARCHIVE_NOT_FOUND, "Archive not found", request);
  }

  @ExceptionHandler(ImportJobNotFoundException.class)
  public ResponseEntity<ApiError> handleImportJobNotFound(
      ImportJobNotFoundException ex, HttpServletRequest request) {
    String errorId = record("import_job_not_found");
    log.warn("Import job not found [{}]: {}", errorId, ex.getJobId());
    return respond(
        HttpStatus.NOT_FOUND,
        errorId,
        ApiError.IMPORT_JOB_NOT_FOUND,
        "Import job not found",
        request);
  }

  @ExceptionHandler(ImportValidationException.class)
  public ResponseEntity<ApiError> handleImportValidation(
      ImportValidationException ex, HttpServletRequest request) {
    String errorId = record("import_validation");
    log.warn("Import rejected [{}]: {}", errorId, ex.getMessage());
    return respond(
        HttpStatus.BAD_REQUEST, errorId, ApiError.IMPORT_INVALID, ex.getMessage(), request);
  }

  @ExceptionHandler(ExtractionException.class)
  public ResponseEntity<ApiError> handleExtraction(
      ExtractionException ex, HttpServletRequest request) {
    String errorId = record("extraction_error");
    log.error("Extraction failed [{}] for {}: {}", errorId, ex.getUrl(), ex.getMessage());
    return respond(
        HttpStatus.UNPROCESSABLE_ENTITY,
        errorId,
        ApiError.EXTRACTION_FAILED,
        "Could not extract content from " + ex.getUrl(),
        request);
  }

  @ExceptionHandler(SearchException.class)
  public ResponseEntity<ApiError> handleSearch(SearchException ex, HttpServletRequest request) {
    String errorId = record("search_error");
    log.error("Search error [{}]: {}", errorId, ex.getMessage(), ex);
    return respond(
        HttpStatus.SERVICE_UNAVAILABLE,
        errorId,
        ApiError.SEARCH_FAILED,
        ex.getUserMessage(),
        request);
  }

  @ExceptionHandler(MethodArgumentNotValidException.class)
  public ResponseEntity<ApiError> handleValidation(
      MethodArgumentNotValidException ex, HttpServletRequest request) {
    String errorId = record("validation_error");
    String message =
        ex.getBindingResult().getFieldErrors().stream()
            .findFirst()
            .map(error -> error.getField() + ": " + error.getDefaultMessage())
            .orElse("Validation failed");
    log.warn("Validation error [{}]: {}", errorId, message);
    return respond(HttpStatus.BAD_REQUEST, errorId, ApiError.VALIDATION_ERROR, message, request);
  }

  @ExceptionHandler(Exception.class)
  public ResponseEntity<ApiError> handleGeneric(Exception ex, HttpServletRequest request) {
    String errorId = record("internal_error");
    log.error("Unexpected error [{}]: {}", errorId, ex.getMessage(), ex);
    return respond(
        HttpStatus.INTERNAL_SERVER_ERROR,
        errorId,
        ApiError.INTERNAL_ERROR,
        "An unexpected error occurred. Please try again later.",
        request);
  }

  private ResponseEntity<ApiError> respond(
      HttpStatus status, String errorId, String code, String message, HttpServletRequest request) {
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

  /** Counts the error and returns a fresh correlation id. */
  private String record(String errorType) {
    meterRegistry.counter("api_errors_total", "error_type", errorType).increment();
    return UUID.randomUUID().toString().substring(0, 8);
  }
}
