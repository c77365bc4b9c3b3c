package com.flamingo.ai.webarchive.exception;

/** Raised by the embedding model when no provider is configured. Never retried. */
public class EmbeddingUnavailableException extends RuntimeException {

  public EmbeddingUnavailableException(String message) {
    super(message);
  }
}
