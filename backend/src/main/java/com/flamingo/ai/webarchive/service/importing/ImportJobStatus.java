package com.flamingo.ai.webarchive.service.importing;

/** Lifecycle of a background import job. */
public enum ImportJobStatus {
  RUNNING,
  COMPLETED,
  CANCELLED,
  FAILED;

  public boolean isFinished() {
    return this != RUNNING;
  }
}
