package com.flamingo.ai.webarchive.exception;

/** Exception thrown when a search cannot be served. */
public class SearchException extends RuntimeException {

  private static final String USER_MESSAGE = "Search is temporarily unavailable. Please try again.";

  public SearchException(String message) {
    super(message);
  }

  public SearchException(String message, Throwable cause) {
    super(message, cause);
  }

  public String getUserMessage() {
    return USER_MESSAGE;
  }
}
