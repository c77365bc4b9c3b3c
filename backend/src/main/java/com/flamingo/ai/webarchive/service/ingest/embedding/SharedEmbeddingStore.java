package com.flamingo.ai.webarchive.service.ingest.embedding;

import com.flamingo.ai.webarchive.domain.entity.ArchiveRecord;
import com.flamingo.ai.webarchive.domain.entity.ContentChunk;
import com.flamingo.ai.webarchive.domain.entity.UserContentLink;
import com.flamingo.ai.webarchive.domain.repository.ArchiveRecordRepository;
import com.flamingo.ai.webarchive.domain.repository.ContentChunkRepository;
import com.flamingo.ai.webarchive.domain.repository.UserContentLinkRepository;
import com.flamingo.ai.webarchive.elasticsearch.ArchiveChunkDocument;
import com.flamingo.ai.webarchive.elasticsearch.ArchiveChunkIndexService;
import com.flamingo.ai.webarchive.service.ingest.ContentHasher;
import com.flamingo.ai.webarchive.service.ingest.chunking.TextChunk;
import com.flamingo.ai.webarchive.service.ingest.chunking.TextChunker;
import com.google.common.base.Strings;
import io.micrometer.core.annotation.Timed;
import io.micrometer.core.instrument.MeterRegistry;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;
import java.util.UUID;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.dao.DataAccessException;
import org.springframework.dao.DataIntegrityViolationException;
import org.springframework.stereotype.Service;

/**
 * Content-addressable chunk store shared across users.
 *
 * <p>A chunk is identified by (hash(url, text), chunkIndex). The first archive to produce a chunk
 * pays for its embedding; every later archive with the same content reuses the stored row and only
 * adds a {@link UserContentLink}. Writes are idempotent and rely on the table's unique keys instead
 * of locks, so concurrent imports of the same page converge on one row.
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class SharedEmbeddingStore {

  private final TextChunker textChunker;
  private final ContentHasher contentHasher;
  private final EmbeddingService embeddingService;
  private final ContentChunkRepository contentChunkRepository;
  private final UserContentLinkRepository userContentLinkRepository;
  private final ArchiveRecordRepository archiveRecordRepository;
  private final ArchiveChunkIndexService archiveChunkIndexService;
  private final MeterRegistry meterRegistry;

  /**
   * Chunks the archive's title, description and text, stores every chunk once, links the chunks
   * to the archive's owner and indexes them for search. A failed chunk is logged and skipped.
   */
  @Timed(value = "archive.embed", description = "Time to chunk, embed and index one archive")
  public EmbeddingOutcome embedArchive(ArchiveRecord archive) {
    List<TextChunk> chunks = textChunker.chunk(combinedText(archive));
    log.info(
        "Processing {} chunks for archive {} ({})",
        chunks.size(),
        archive.getId(),
        archive.getUrl());

    int reused = 0;
    int created = 0;
    int failed = 0;
    List<ArchiveChunkDocument> documents = new ArrayList<>(chunks.size());
    for (TextChunk chunk : chunks) {
      try {
        StoredChunk stored = ensureEmbedded(archive.getUrl(), archive.getTitle(), chunk);
        if (stored.reused()) {
          reused++;
        } else {
          created++;
        }
        linkToUser(archive, stored.chunk().getId());
        documents.add(toDocument(archive, stored.chunk()));
      } catch (DataAccessException e) {
        failed++;
        log.warn(
            "Skipping chunk {} of archive {}: {}", chunk.index(), archive.getId(), e.getMessage());
        meterRegistry.counter("content.chunks.failed").increment();
      }
    }

    archiveChunkIndexService.indexChunks(documents);
    archive.setChunkCount(chunks.size());
    archiveRecordRepository.save(archive);

    log.info(
        "Archive {} embedded: {} chunks, {} reused, {} new, {} failed",
        archive.getId(),
        chunks.size(),
        reused,
        created,
        failed);
    return new EmbeddingOutcome(chunks.size(), reused, created, failed);
  }

  /**
   * Returns the stored chunk for this content, creating it if needed. The embedding provider is
   * called when no row exists yet, or when the row was stored without a vector and the provider is
   * available now; an unavailable provider stores the chunk without a vector.
   */
  public StoredChunk ensureEmbedded(String sourceUrl, String archiveTitle, TextChunk chunk) {
    String hash = contentHasher.hash(sourceUrl, chunk.content());
    Optional<ContentChunk> existing =
        contentChunkRepository.findByContentHashAndChunkIndex(hash, chunk.index());
    if (existing.isPresent()) {
      log.debug("Reusing existing content for chunk {} of {}", chunk.index(), sourceUrl);
      meterRegistry.counter("content.chunks.reused").increment();
      ContentChunk stored = existing.get();
      if (!stored.hasEmbedding() && embeddingService.isEnabled()) {
        backfillEmbedding(stored);
      }
      return new StoredChunk(stored, true);
    }

    List<Float> vector = embeddingService.embedPassage(chunk.content());
    ContentChunk candidate =
        ContentChunk.builder()
            .contentHash(hash)
            .chunkIndex(chunk.index())
            .sourceUrl(sourceUrl)
            .title(archiveTitle)
            .chunkText(chunk.content())
            .embedding(vector.isEmpty() ? null : vector)
            .build();
    try {
      ContentChunk saved = contentChunkRepository.saveAndFlush(candidate);
      meterRegistry.counter("content.chunks.created").increment();
      return new StoredChunk(saved, false);
    } catch (DataIntegrityViolationException e) {
      // another import stored the same chunk first
      ContentChunk winner =
          contentChunkRepository
              .findByContentHashAndChunkIndex(hash, chunk.index())
              .orElseThrow(() -> e);
      return new StoredChunk(winner, true);
    }
  }

  private void backfillEmbedding(ContentChunk stored) {
    List<Float> vector = embeddingService.embedPassage(stored.getChunkText());
    if (vector.isEmpty()) {
      return;
    }
    stored.setEmbedding(vector);
    contentChunkRepository.save(stored);
    log.info("Added missing embedding to content {} ({})", stored.getId(), stored.getSourceUrl());
    meterRegistry.counter("content.chunks.backfilled").increment();
  }

  private void linkToUser(ArchiveRecord archive, UUID contentId) {
    if (userContentLinkRepository.existsByUserIdAndContentIdAndArchiveId(
        archive.getUserId(), contentId, archive.getId())) {
      return;
    }
    try {
      userContentLinkRepository.saveAndFlush(
          UserContentLink.builder()
              .userId(archive.getUserId())
              .contentId(contentId)
              .archiveId(archive.getId())
              .tags(new ArrayList<>(archive.getTags()))
              .build());
    } catch (DataIntegrityViolationException e) {
      log.debug("Link for content {} already exists for archive {}", contentId, archive.getId());
    }
  }

  private static ArchiveChunkDocument toDocument(ArchiveRecord archive, ContentChunk chunk) {
    return ArchiveChunkDocument.builder()
        .id(ArchiveChunkDocument.documentIdFor(archive.getId(), chunk.getChunkIndex()))
        .userId(archive.getUserId())
        .archiveId(archive.getId())
        .contentId(chunk.getId())
        .url(archive.getUrl())
        .title(archive.getTitle())
        .tags(archive.getTags())
        .chunkIndex(chunk.getChunkIndex())
        .content(chunk.getChunkText())
        .embedding(chunk.getEmbedding())
        .build();
  }

  static String combinedText(ArchiveRecord archive) {
    return Strings.nullToEmpty(archive.getTitle())
        + "\n\n"
        + Strings.nullToEmpty(archive.getDescription())
        + "\n\n"
        + Strings.nullToEmpty(archive.getTextContent());
  }

  /** A stored chunk and whether it already existed before this call. */
  public record StoredChunk(ContentChunk chunk, boolean reused) {}
}
