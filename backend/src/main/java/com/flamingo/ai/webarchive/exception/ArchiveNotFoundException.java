package com.flamingo.ai.webarchive.exception;

import java.util.UUID;

/** Exception thrown when an archive is not found. */
public class ArchiveNotFoundException extends RuntimeException {

  private final UUID archiveId;

  public ArchiveNotFoundException(UUID archiveId) {
    super("Archive not found: " + archiveId);
    this.archiveId = archiveId;
  }

  public UUID getArchiveId() {
    return archiveId;
  }
}
