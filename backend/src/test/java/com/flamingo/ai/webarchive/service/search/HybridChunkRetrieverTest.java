package com.flamingo.ai.webarchive.service.search;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.within;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyInt;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

import com.flamingo.ai.webarchive.config.ArchiveConfig;
import com.flamingo.ai.webarchive.elasticsearch.ArchiveChunkDocument;
import com.flamingo.ai.webarchive.elasticsearch.ArchiveChunkIndexService;
import java.util.List;
import java.util.UUID;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

@ExtendWith(MockitoExtension.class)
class HybridChunkRetrieverTest {

  @Mock private ArchiveChunkIndexService archiveChunkIndexService;

  private HybridChunkRetriever hybridChunkRetriever;
  private UUID userId;

  @BeforeEach
  void setUp() {
    hybridChunkRetriever = new HybridChunkRetriever(archiveChunkIndexService, new ArchiveConfig());
    userId = UUID.randomUUID();
  }

  @Nested
  @DisplayName("fuse")
  class FuseTests {

    @Test
    @DisplayName("should rank a chunk found by both retrievers first")
    void shouldRankOverlapFirst() {
      ArchiveChunkDocument a = chunk("a");
      ArchiveChunkDocument b = chunk("b");
      ArchiveChunkDocument c = chunk("c");

      List<SearchHit> hits = hybridChunkRetriever.fuse(List.of(a, b), List.of(b, c));

      assertThat(hits).extracting(SearchHit::content).containsExactly("b", "a", "c");
      assertThat(hits.get(0).score()).isCloseTo((61.0 / 62 + 1) / 2, within(1e-9));
      assertThat(hits)
          .extracting(SearchHit::matchType)
          .containsExactly(MatchType.SEMANTIC, MatchType.LEXICAL, MatchType.SEMANTIC);
    }

    @Test
    @DisplayName("should score the top keyword-only hit as 1.0")
    void shouldNormalizeKeywordOnlyScores() {
      List<SearchHit> hits = hybridChunkRetriever.fuse(List.of(chunk("a"), chunk("b")), List.of());

      assertThat(hits.get(0).score()).isEqualTo(1.0);
      assertThat(hits.get(1).score()).isLessThan(1.0);
      assertThat(hits).allMatch(hit -> hit.matchType() == MatchType.LEXICAL);
    }

    @Test
    @DisplayName("should keep keyword hits ahead of vector hits on equal scores")
    void shouldBreakTiesByRetrievalOrder() {
      List<SearchHit> hits = hybridChunkRetriever.fuse(List.of(chunk("k")), List.of(chunk("v")));

      assertThat(hits).extracting(SearchHit::content).containsExactly("k", "v");
      assertThat(hits.get(0).score()).isEqualTo(hits.get(1).score());
    }

    @Test
    @DisplayName("should return nothing when neither retriever has hits")
    void shouldReturnEmpty() {
      assertThat(hybridChunkRetriever.fuse(List.of(), List.of())).isEmpty();
    }
  }

  @Test
  @DisplayName("should not run vector search without a query embedding")
  void shouldSkipVectorSearchWithoutEmbedding() {
    when(archiveChunkIndexService.keywordSearch(eq(userId), eq("query"), anyInt()))
        .thenReturn(List.of(chunk("a")));

    List<SearchHit> hits = hybridChunkRetriever.retrieve(userId, "query", List.of());

    assertThat(hits).hasSize(1);
    verify(archiveChunkIndexService, never()).vectorSearch(any(), any(), anyInt());
  }

  @Test
  @DisplayName("should run both searches with a query embedding")
  void shouldRunBothSearches() {
    List<Float> embedding = List.of(0.1f, 0.2f);
    when(archiveChunkIndexService.keywordSearch(eq(userId), eq("query"), anyInt()))
        .thenReturn(List.of());
    when(archiveChunkIndexService.vectorSearch(eq(userId), eq(embedding), anyInt()))
        .thenReturn(List.of(chunk("a")));

    List<SearchHit> hits = hybridChunkRetriever.retrieve(userId, "query", embedding);

    assertThat(hits).singleElement().extracting(SearchHit::matchType).isEqualTo(MatchType.SEMANTIC);
  }

  private static ArchiveChunkDocument chunk(String name) {
    UUID archiveId = UUID.randomUUID();
    return ArchiveChunkDocument.builder()
        .id(ArchiveChunkDocument.documentIdFor(archiveId, 0))
        .archiveId(archiveId)
        .url("https://example.com/" + name)
        .title(name)
        .chunkIndex(0)
        .content(name)
        .build();
  }
}
