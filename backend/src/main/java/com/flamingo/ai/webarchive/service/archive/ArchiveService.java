package com.flamingo.ai.webarchive.service.archive;

import com.flamingo.ai.webarchive.domain.entity.ArchiveRecord;
import java.util.List;
import java.util.UUID;

/** Service for reading, deleting and re-embedding archives. */
public interface ArchiveService {

  /** Archives of a user, newest first. */
  List<ArchiveRecord> listForUser(UUID userId);

  ArchiveRecord get(UUID archiveId);

  /**
   * Deletes an archive with the user's links to its content and its index entries. Shared content
   * rows stay, since other users may reference them.
   */
  void delete(UUID archiveId);

  /**
   * Runs every archive of the user through the shared embedding store again. Content that is
   * already stored is reused, so only new chunks reach the embedding provider.
   *
   * @return number of archives processed successfully
   */
  int reprocessEmbeddings(UUID userId);
}
