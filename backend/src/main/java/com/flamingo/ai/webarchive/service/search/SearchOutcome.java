package com.flamingo.ai.webarchive.service.search;

import java.util.List;

/**
 * Ranked result groups of one search.
 *
 * @param semanticEnabled whether an embedding provider is configured
 * @param semanticUsed whether any returned group was matched by vector search
 */
public record SearchOutcome(
    String query,
    List<SearchResultGroup> groups,
    boolean semanticEnabled,
    boolean semanticUsed,
    long searchTimeMs) {

  /** Mean relevance of the returned groups rounded to two decimals. */
  public double averageRelevance() {
    double average =
        groups.stream().mapToDouble(SearchResultGroup::relevanceScore).average().orElse(0.0);
    return Math.round(average * 100) / 100.0;
  }
}
