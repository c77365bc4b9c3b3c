package com.flamingo.ai.webarchive.service.search;

import com.flamingo.ai.webarchive.config.ArchiveConfig;
import com.flamingo.ai.webarchive.elasticsearch.ArchiveChunkDocument;
import com.flamingo.ai.webarchive.elasticsearch.ArchiveChunkIndexService;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.UUID;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

/**
 * Runs keyword and vector search over a user's chunks and fuses them with Reciprocal Rank Fusion.
 *
 * <p>RRF score = sum of 1/(k + rank) over the retrievers that returned the chunk, divided by the
 * best score reachable with the retrievers used, so a chunk ranked first everywhere scores 1.0.
 * Without a query vector only keyword search runs.
 */
@Component
@RequiredArgsConstructor
@Slf4j
public class HybridChunkRetriever {

  private final ArchiveChunkIndexService archiveChunkIndexService;
  private final ArchiveConfig archiveConfig;

  public List<SearchHit> retrieve(UUID userId, String query, List<Float> queryEmbedding) {
    int candidates = archiveConfig.getSearch().getCandidateCount();
    List<ArchiveChunkDocument> keywordResults =
        archiveChunkIndexService.keywordSearch(userId, query, candidates);
    List<ArchiveChunkDocument> vectorResults =
        queryEmbedding.isEmpty()
            ? List.of()
            : archiveChunkIndexService.vectorSearch(userId, queryEmbedding, candidates);
    log.debug(
        "Retrieved {} keyword and {} vector candidates for user {}",
        keywordResults.size(),
        vectorResults.size(),
        userId);
    return fuse(keywordResults, vectorResults);
  }

  List<SearchHit> fuse(
      List<ArchiveChunkDocument> keywordResults, List<ArchiveChunkDocument> vectorResults) {
    int rrfK = archiveConfig.getSearch().getRrfK();
    // insertion order is the tie-break: keyword hits first, then vector-only hits
    Map<String, Fused> fused = new LinkedHashMap<>();
    accumulate(fused, keywordResults, MatchType.LEXICAL, rrfK);
    accumulate(fused, vectorResults, MatchType.SEMANTIC, rrfK);

    int retrievers = (keywordResults.isEmpty() ? 0 : 1) + (vectorResults.isEmpty() ? 0 : 1);
    double maxScore = retrievers / (double) (rrfK + 1);

    List<Fused> ranked = new ArrayList<>(fused.values());
    ranked.sort(Comparator.comparingDouble(Fused::score).reversed());
    return ranked.stream().map(f -> f.toHit(maxScore)).toList();
  }

  private static void accumulate(
      Map<String, Fused> fused, List<ArchiveChunkDocument> results, MatchType type, int rrfK) {
    for (int rank = 0; rank < results.size(); rank++) {
      ArchiveChunkDocument document = results.get(rank);
      double contribution = 1.0 / (rrfK + rank + 1);
      Fused entry = fused.computeIfAbsent(document.getId(), id -> new Fused(document));
      entry.add(contribution, type);
    }
  }

  private static final class Fused {
    private final ArchiveChunkDocument document;
    private double score;
    private double bestContribution;
    private MatchType matchType;

    Fused(ArchiveChunkDocument document) {
      this.document = document;
    }

    void add(double contribution, MatchType type) {
      score += contribution;
      if (contribution > bestContribution) {
        bestContribution = contribution;
        matchType = type;
      }
    }

    double score() {
      return score;
    }

    SearchHit toHit(double maxScore) {
      return new SearchHit(
          document.getArchiveId(),
          document.getContentId(),
          document.getUrl(),
          document.getTitle(),
          document.getTags(),
          document.getChunkIndex(),
          document.getContent(),
          maxScore > 0 ? score / maxScore : 0.0,
          matchType);
    }
  }
}
