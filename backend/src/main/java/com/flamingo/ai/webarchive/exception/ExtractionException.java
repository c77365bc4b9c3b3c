package com.flamingo.ai.webarchive.exception;

/** Exception thrown when page content cannot be extracted from a URL. */
public class ExtractionException extends RuntimeException {

  private final String url;

  public ExtractionException(String url, String message) {
    super(message);
    this.url = url;
  }

  public ExtractionException(String url, String message, Throwable cause) {
    super(message, cause);
    this.url = url;
  }

  public String getUrl() {
    return url;
  }
}
