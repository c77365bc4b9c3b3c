package com.flamingo.ai.webarchive.api.dto.response;

import com.flamingo.ai.webarchive.service.search.SearchOutcome;
import com.flamingo.ai.webarchive.service.search.SearchResultGroup;
import java.util.List;
import lombok.Builder;
import lombok.Value;

/** Response DTO for a search. */
@Value
@Builder
public class SearchResponse {

  String query;

  /** "hybrid" when any result came from vector search, otherwise "text". */
  String mode;

  List<SearchResultGroup> results;
  int totalCount;
  Metadata metadata;

  public static SearchResponse from(SearchOutcome outcome) {
    return SearchResponse.builder()
        .query(outcome.query())
        .mode(outcome.semanticUsed() ? "hybrid" : "text")
        .results(outcome.groups())
        .totalCount(outcome.groups().size())
        .metadata(
            new Metadata(
                outcome.semanticEnabled(), outcome.averageRelevance(), outcome.searchTimeMs()))
        .build();
  }

  /** Search diagnostics. */
  public record Metadata(boolean semanticEnabled, double avgRelevance, long searchTimeMs) {}
}
