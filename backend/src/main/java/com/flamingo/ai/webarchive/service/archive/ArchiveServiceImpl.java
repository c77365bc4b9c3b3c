package com.flamingo.ai.webarchive.service.archive;

import com.flamingo.ai.webarchive.domain.entity.ArchiveRecord;
import com.flamingo.ai.webarchive.domain.repository.ArchiveRecordRepository;
import com.flamingo.ai.webarchive.domain.repository.UserContentLinkRepository;
import com.flamingo.ai.webarchive.elasticsearch.ArchiveChunkIndexService;
import com.flamingo.ai.webarchive.exception.ArchiveNotFoundException;
import com.flamingo.ai.webarchive.service.ingest.embedding.SharedEmbeddingStore;
import io.micrometer.core.annotation.Timed;
import io.micrometer.core.instrument.MeterRegistry;
import java.util.List;
import java.util.UUID;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

/** Implementation of ArchiveService. */
@Service
@RequiredArgsConstructor
@Slf4j
public class ArchiveServiceImpl implements ArchiveService {

  private final ArchiveRecordRepository archiveRecordRepository;
  private final UserContentLinkRepository userContentLinkRepository;
  private final ArchiveChunkIndexService archiveChunkIndexService;
  private final SharedEmbeddingStore sharedEmbeddingStore;
  private final MeterRegistry meterRegistry;

  @Override
  @Transactional(readOnly = true)
  public List<ArchiveRecord> listForUser(UUID userId) {
    return archiveRecordRepository.findByUserIdOrderByCreatedAtDesc(userId);
  }

  @Override
  @Transactional(readOnly = true)
  public ArchiveRecord get(UUID archiveId) {
    return archiveRecordRepository
        .findById(archiveId)
        .orElseThrow(() -> new ArchiveNotFoundException(archiveId));
  }

  @Override
  @Transactional
  @Timed(value = "archive.delete", description = "Time to delete an archive")
  public void delete(UUID archiveId) {
    ArchiveRecord archive = get(archiveId);
    int links = userContentLinkRepository.deleteByArchiveId(archiveId);
    archiveChunkIndexService.deleteByArchiveId(archiveId);
    archiveRecordRepository.delete(archive);
    meterRegistry.counter("archive.deleted").increment();
    log.info("Deleted archive {} ({}) and {} content links", archiveId, archive.getUrl(), links);
  }

  @Override
  @Timed(value = "archive.reprocess", description = "Time to re-embed a user's archives")
  public int reprocessEmbeddings(UUID userId) {
    List<ArchiveRecord> archives = archiveRecordRepository.findByUserIdOrderByCreatedAtDesc(userId);
    log.info("Reprocessing embeddings for {} archives of user {}", archives.size(), userId);

    int processed = 0;
    for (ArchiveRecord archive : archives) {
      try {
        sharedEmbeddingStore.embedArchive(archive);
        processed++;
      } catch (RuntimeException e) {
        log.warn("Reprocessing archive {} failed: {}", archive.getId(), e.getMessage());
        meterRegistry.counter("archive.reprocess.failures").increment();
      }
    }
    log.info("Reprocessed {}/{} archives for user {}", processed, archives.size(), userId);
    return processed;
  }
}
