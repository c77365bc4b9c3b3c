package com.flamingo.ai.webarchive.domain.repository;

import com.flamingo.ai.webarchive.domain.entity.UserContentLink;
import java.util.List;
import java.util.UUID;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Modifying;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;
import org.springframework.stereotype.Repository;
import org.springframework.transaction.annotation.Transactional;

/** Repository for UserContentLink entities. */
@Repository
public interface UserContentLinkRepository extends JpaRepository<UserContentLink, UUID> {

  boolean existsByUserIdAndContentIdAndArchiveId(UUID userId, UUID contentId, UUID archiveId);

  List<UserContentLink> findByArchiveId(UUID archiveId);

  long countByContentId(UUID contentId);

  @Modifying
  @Transactional
  @Query("DELETE FROM UserContentLink l WHERE l.archiveId = :archiveId")
  int deleteByArchiveId(@Param("archiveId") UUID archiveId);
}
