package com.flamingo.ai.webarchive.exception;

import java.time.Instant;
import lombok.Builder;
import lombok.Getter;

/** Structured API error response. */
@Getter
@Builder
public class ApiError {

  public static final String ARCHIVE_NOT_FOUND = "ARCHIVE_001";
  public static final String IMPORT_INVALID = "IMPORT_001";
  public static final String IMPORT_JOB_NOT_FOUND = "IMPORT_002";
  public static final String EXTRACTION_FAILED = "EXTRACT_001";
  public static final String SEARCH_FAILED = "SEARCH_001";
  public static final String VALIDATION_ERROR = "VALIDATION_001";
  public static final String INTERNAL_ERROR = "INTERNAL_001";

  /** Short id printed in the log line for the same failure. */
  private final String errorId;

  private final String code;

  private final String message;

  private final String details;

  private final Instant timestamp;

  private final String path;
}
