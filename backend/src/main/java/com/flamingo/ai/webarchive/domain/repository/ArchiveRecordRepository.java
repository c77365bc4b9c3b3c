package com.flamingo.ai.webarchive.domain.repository;

import com.flamingo.ai.webarchive.domain.entity.ArchiveRecord;
import java.time.LocalDateTime;
import java.util.Collection;
import java.util.List;
import java.util.Optional;
import java.util.UUID;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;
import org.springframework.stereotype.Repository;

/** Repository for ArchiveRecord entities. */
@Repository
public interface ArchiveRecordRepository extends JpaRepository<ArchiveRecord, UUID> {

  boolean existsByUserIdAndUrl(UUID userId, String url);

  Optional<ArchiveRecord> findByUserIdAndUrl(UUID userId, String url);

  List<ArchiveRecord> findByUserIdOrderByCreatedAtDesc(UUID userId);

  List<ArchiveRecord> findByUserIdAndCreatedAtAfterOrderByCreatedAtDesc(
      UUID userId, LocalDateTime since);

  long countByUserId(UUID userId);

  /** Returns the subset of {@code urls} the user has already archived. */
  @Query("SELECT a.url FROM ArchiveRecord a WHERE a.userId = :userId AND a.url IN :urls")
  List<String> findArchivedUrls(
      @Param("userId") UUID userId, @Param("urls") Collection<String> urls);
}
