package com.flamingo.ai.webarchive.exception;

/** Thrown when an import list is rejected before any ingestion starts. */
public class ImportValidationException extends RuntimeException {

  public ImportValidationException(String message) {
    super(message);
  }
}
