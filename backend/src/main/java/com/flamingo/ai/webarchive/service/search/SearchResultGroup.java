package com.flamingo.ai.webarchive.service.search;

import java.time.LocalDateTime;
import java.util.List;
import java.util.UUID;

/** All hits of one archive, with the archive's display fields and a highlighted snippet. */
public record SearchResultGroup(
    UUID id,
    String title,
    String description,
    String url,
    List<String> tags,
    LocalDateTime createdAt,
    double relevanceScore,
    String snippet,
    List<MatchingChunk> matchingChunks,
    MatchType matchType) {

  /** Highlighted excerpt of a chunk that matched. */
  public record MatchingChunk(int chunkIndex, String content, double score) {}
}
