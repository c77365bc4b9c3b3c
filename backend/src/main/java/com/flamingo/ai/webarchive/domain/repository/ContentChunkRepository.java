package com.flamingo.ai.webarchive.domain.repository;

import com.flamingo.ai.webarchive.domain.entity.ContentChunk;
import java.util.List;
import java.util.Optional;
import java.util.UUID;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;
import org.springframework.stereotype.Repository;

/** Repository for shared ContentChunk entities. */
@Repository
public interface ContentChunkRepository extends JpaRepository<ContentChunk, UUID> {

  Optional<ContentChunk> findByContentHashAndChunkIndex(String contentHash, Integer chunkIndex);

  /** Chunks linked to an archive, in chunk order. */
  @Query(
      "SELECT c FROM ContentChunk c WHERE c.id IN "
          + "(SELECT l.contentId FROM UserContentLink l WHERE l.archiveId = :archiveId) "
          + "ORDER BY c.chunkIndex ASC")
  List<ContentChunk> findByArchiveId(@Param("archiveId") UUID archiveId);
}
