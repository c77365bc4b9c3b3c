package com.flamingo.ai.webarchive.service.importing;

import java.util.UUID;

/**
 * Outcome of importing one item.
 *
 * @param skipped the url was found archived while processing, so nothing new was created
 * @param archiveId the created or pre-existing archive, null on failure
 * @param attempts extraction attempts made; 0 when extraction was not needed
 */
public record ImportResult(
    String url,
    boolean success,
    boolean skipped,
    String error,
    UUID archiveId,
    String title,
    int attempts) {

  public static ImportResult archived(String url, UUID archiveId, String title, int attempts) {
    return new ImportResult(url, true, false, null, archiveId, title, attempts);
  }

  public static ImportResult alreadyArchived(String url, UUID archiveId, String title) {
    return new ImportResult(url, true, true, null, archiveId, title, 0);
  }

  public static ImportResult failed(String url, String error, int attempts) {
    return new ImportResult(url, false, false, error, null, null, attempts);
  }
}
