package com.flamingo.ai.webarchive.service.search;

import com.flamingo.ai.webarchive.config.ArchiveConfig;
import com.flamingo.ai.webarchive.domain.entity.ArchiveRecord;
import com.flamingo.ai.webarchive.domain.repository.ArchiveRecordRepository;
import com.flamingo.ai.webarchive.exception.SearchException;
import com.flamingo.ai.webarchive.service.ingest.embedding.EmbeddingService;
import io.micrometer.core.annotation.Timed;
import io.micrometer.core.instrument.MeterRegistry;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.UUID;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.dao.DataAccessException;
import org.springframework.stereotype.Service;

/**
 * Searches a user's archives.
 *
 * <p>Chunk hits are grouped per archive in the order the retriever returned them. Each group keeps
 * its best hit score and gets a snippet cut from the archive's full text. Groups are sorted by
 * score, descending; the sort is stable, so equal scores keep retrieval order.
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class ArchiveSearchService {

  private static final String UNTITLED = "Untitled";

  private final EmbeddingService embeddingService;
  private final HybridChunkRetriever hybridChunkRetriever;
  private final ArchiveRecordRepository archiveRecordRepository;
  private final SnippetExtractor snippetExtractor;
  private final ArchiveConfig archiveConfig;
  private final MeterRegistry meterRegistry;

  @Timed(value = "archive.search", description = "Time for archive search")
  public SearchOutcome search(String query, UUID userId, Integer limit) {
    long startedAt = System.currentTimeMillis();
    int maxGroups =
        limit != null && limit > 0 ? limit : archiveConfig.getSearch().getDefaultLimit();

    List<Float> queryEmbedding = embeddingService.embedQuery(query);
    if (queryEmbedding.isEmpty()) {
      log.debug("No query embedding, searching by keyword only");
    }
    List<SearchHit> hits = hybridChunkRetriever.retrieve(userId, query, queryEmbedding);

    List<SearchResultGroup> groups;
    try {
      groups = rank(group(hits, snippetExtractor.queryTerms(query)), maxGroups);
    } catch (DataAccessException e) {
      meterRegistry.counter("archive.search.failure").increment();
      throw new SearchException("Failed to load archives for search results", e);
    }

    boolean semanticUsed = groups.stream().anyMatch(g -> g.matchType() == MatchType.SEMANTIC);
    long elapsed = System.currentTimeMillis() - startedAt;
    log.info(
        "Search '{}' for user {}: {} results from {} hits in {} ms (semantic: {})",
        query,
        userId,
        groups.size(),
        hits.size(),
        elapsed,
        semanticUsed);
    meterRegistry.counter("archive.search.success").increment();
    return new SearchOutcome(query, groups, embeddingService.isEnabled(), semanticUsed, elapsed);
  }

  /** Folds hits into one group per archive, in first-seen order. */
  List<SearchResultGroup> group(List<SearchHit> hits, List<String> terms) {
    Map<UUID, GroupBuilder> builders = new LinkedHashMap<>();
    for (SearchHit hit : hits) {
      builders.computeIfAbsent(hit.archiveId(), id -> new GroupBuilder(hit)).add(hit, terms);
    }

    List<SearchResultGroup> groups = new ArrayList<>(builders.size());
    for (GroupBuilder builder : builders.values()) {
      Optional<ArchiveRecord> archive = archiveRecordRepository.findById(builder.first.archiveId());
      groups.add(builder.build(archive.orElse(null), terms));
    }
    return groups;
  }

  static List<SearchResultGroup> rank(List<SearchResultGroup> groups, int limit) {
    List<SearchResultGroup> sorted = new ArrayList<>(groups);
    // List.sort is stable
    sorted.sort(Comparator.comparingDouble(SearchResultGroup::relevanceScore).reversed());
    return sorted.subList(0, Math.min(limit, sorted.size()));
  }

  private final class GroupBuilder {
    private final SearchHit first;
    private double bestScore;
    private final List<SearchResultGroup.MatchingChunk> chunks = new ArrayList<>();

    GroupBuilder(SearchHit first) {
      this.first = first;
    }

    GroupBuilder add(SearchHit hit, List<String> terms) {
      bestScore = Math.max(bestScore, hit.score());
      if (hit.content() != null && !hit.content().isEmpty()) {
        chunks.add(
            new SearchResultGroup.MatchingChunk(
                hit.chunkIndex(), snippetExtractor.excerpt(hit.content(), terms), hit.score()));
      }
      return this;
    }

    SearchResultGroup build(ArchiveRecord archive, List<String> terms) {
      String text;
      String description = "";
      if (archive != null) {
        description = archive.getDescription() != null ? archive.getDescription() : "";
        text = archive.getTextContent() != null ? archive.getTextContent() : description;
      } else {
        // stale index entry; fall back to the indexed chunk
        text = first.content();
      }
      String title = archive != null ? archive.getTitle() : first.title();
      return new SearchResultGroup(
          first.archiveId(),
          title == null || title.isBlank() ? UNTITLED : title,
          description,
          archive != null ? archive.getUrl() : first.url(),
          archive != null ? archive.getTags() : first.tags(),
          archive != null ? archive.getCreatedAt() : null,
          bestScore,
          snippetExtractor.highlight(snippetExtractor.snippet(text, terms), terms),
          List.copyOf(chunks),
          first.matchType());
    }
  }
}
