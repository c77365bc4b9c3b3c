package com.flamingo.ai.webarchive.elasticsearch;

import co.elastic.clients.elasticsearch.ElasticsearchClient;
import co.elastic.clients.elasticsearch._types.mapping.DenseVectorSimilarity;
import co.elastic.clients.elasticsearch._types.mapping.Property;
import co.elastic.clients.elasticsearch._types.query_dsl.Query;
import co.elastic.clients.elasticsearch._types.query_dsl.TextQueryType;
import co.elastic.clients.elasticsearch.core.SearchRequest;
import com.google.common.annotations.VisibleForTesting;
import io.github.resilience4j.circuitbreaker.annotation.CircuitBreaker;
import io.micrometer.core.annotation.Timed;
import io.micrometer.core.instrument.MeterRegistry;
import java.io.IOException;
import java.io.UncheckedIOException;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.UUID;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Service;

/**
 * Elasticsearch index of archive chunks, queried by keyword (BM25 over title and content) and by
 * kNN over the chunk vectors. Every query is filtered to one user.
 */
@Service
@Slf4j
public class ArchiveChunkIndexService
    extends AbstractElasticsearchIndexService<ArchiveChunkDocument> {

  @Value("${app.elasticsearch.index-name:web-archive-chunks}")
  private String indexName;

  @Value("${archive.embedding.dimensions:768}")
  private int vectorDimensions;

  @Autowired
  public ArchiveChunkIndexService(
      ElasticsearchClient elasticsearchClient, MeterRegistry meterRegistry) {
    super(elasticsearchClient, meterRegistry);
  }

  @VisibleForTesting
  public ArchiveChunkIndexService(
      ElasticsearchClient elasticsearchClient,
      MeterRegistry meterRegistry,
      String indexName,
      int vectorDimensions) {
    super(elasticsearchClient, meterRegistry);
    this.indexName = indexName;
    this.vectorDimensions = vectorDimensions;
  }

  @Override
  public String getIndexName() {
    return indexName;
  }

  @Override
  protected Map<String, Property> defineIndexProperties() {
    Map<String, Property> properties = new HashMap<>();
    // ids must be keyword for exact-match filters
    properties.put("userId", Property.of(p -> p.keyword(k -> k)));
    properties.put("archiveId", Property.of(p -> p.keyword(k -> k)));
    properties.put("contentId", Property.of(p -> p.keyword(k -> k)));
    properties.put("url", Property.of(p -> p.keyword(k -> k)));
    properties.put("tags", Property.of(p -> p.keyword(k -> k)));
    properties.put("title", Property.of(p -> p.text(t -> t)));
    properties.put("content", Property.of(p -> p.text(t -> t)));
    properties.put("chunkIndex", Property.of(p -> p.integer(i -> i)));
    properties.put(
        "embedding",
        Property.of(
            p ->
                p.denseVector(
                    d ->
                        d.dims(vectorDimensions)
                            .index(true)
                            .similarity(DenseVectorSimilarity.Cosine))));
    return properties;
  }

  @Override
  protected Map<String, Object> convertToDocument(ArchiveChunkDocument chunk) {
    Map<String, Object> document = new HashMap<>();
    document.put("userId", chunk.getUserId().toString());
    document.put("archiveId", chunk.getArchiveId().toString());
    document.put("contentId", chunk.getContentId().toString());
    document.put("url", chunk.getUrl());
    document.put("title", chunk.getTitle());
    document.put("tags", chunk.getTags());
    document.put("chunkIndex", chunk.getChunkIndex());
    document.put("content", chunk.getContent());
    // a dense_vector field may be absent but never empty
    if (chunk.getEmbedding() != null && !chunk.getEmbedding().isEmpty()) {
      document.put("embedding", chunk.getEmbedding());
    }
    return document;
  }

  @Override
  @SuppressWarnings("unchecked")
  protected ArchiveChunkDocument convertFromDocument(
      String id, Map<String, Object> source, Double score) {
    Object tags = source.get("tags");
    Object chunkIndex = source.get("chunkIndex");
    return ArchiveChunkDocument.builder()
        .id(id)
        .userId(UUID.fromString((String) source.get("userId")))
        .archiveId(UUID.fromString((String) source.get("archiveId")))
        .contentId(UUID.fromString((String) source.get("contentId")))
        .url((String) source.get("url"))
        .title((String) source.get("title"))
        .tags(tags instanceof List<?> list ? (List<String>) list : List.of())
        .chunkIndex(chunkIndex instanceof Number n ? n.intValue() : 0)
        .content((String) source.get("content"))
        .relevanceScore(score != null ? score : 0.0)
        .build();
  }

  @Override
  protected String getDocumentId(ArchiveChunkDocument entity) {
    return entity.getId() != null
        ? entity.getId()
        : ArchiveChunkDocument.documentIdFor(entity.getArchiveId(), entity.getChunkIndex());
  }

  @Override
  protected String getMetricPrefix() {
    return "archive_chunk";
  }

  @Timed(value = "elasticsearch.index", description = "Time to index archive chunks")
  @CircuitBreaker(name = "elasticsearch", fallbackMethod = "indexChunksFallback")
  public void indexChunks(List<ArchiveChunkDocument> chunks) {
    try {
      bulkIndex(chunks);
    } catch (IOException e) {
      throw new UncheckedIOException("Failed to index archive chunks", e);
    }
  }

  @SuppressWarnings("unused")
  private void indexChunksFallback(List<ArchiveChunkDocument> chunks, Throwable t) {
    log.warn("Indexing {} chunks skipped, index unavailable: {}", chunks.size(), t.getMessage());
    meterRegistry.counter(getMetricPrefix() + ".index.fallback").increment();
  }

  @Timed(value = "elasticsearch.keyword_search", description = "Time for keyword search")
  @CircuitBreaker(name = "elasticsearch", fallbackMethod = "keywordSearchFallback")
  public List<ArchiveChunkDocument> keywordSearch(UUID userId, String query, int topK) {
    SearchRequest request =
        SearchRequest.of(
            s ->
                s.index(indexName)
                    .query(
                        q ->
                            q.bool(
                                b ->
                                    b.filter(userFilter(userId))
                                        .must(
                                            m ->
                                                m.multiMatch(
                                                    mm ->
                                                        mm.fields("title^2.0", "content")
                                                            .query(query)
                                                            .type(TextQueryType.BestFields)
                                                            .tieBreaker(0.3)))))
                    .size(topK));
    try {
      return executeSearch(request, "keyword_search");
    } catch (IOException e) {
      throw new UncheckedIOException("Keyword search failed", e);
    }
  }

  @SuppressWarnings("unused")
  private List<ArchiveChunkDocument> keywordSearchFallback(
      UUID userId, String query, int topK, Throwable t) {
    log.warn("Keyword search fallback for user {}: {}", userId, t.getMessage());
    meterRegistry.counter(getMetricPrefix() + ".keyword_search.fallback").increment();
    return List.of();
  }

  @Timed(value = "elasticsearch.vector_search", description = "Time for vector search")
  @CircuitBreaker(name = "elasticsearch", fallbackMethod = "vectorSearchFallback")
  public List<ArchiveChunkDocument> vectorSearch(
      UUID userId, List<Float> queryEmbedding, int topK) {
    SearchRequest request =
        SearchRequest.of(
            s ->
                s.index(indexName)
                    .knn(
                        k ->
                            k.field("embedding")
                                .queryVector(queryEmbedding)
                                .k(topK)
                                .numCandidates(topK * 2)
                                .filter(userFilter(userId)))
                    .size(topK));
    try {
      return executeSearch(request, "vector_search");
    } catch (IOException e) {
      throw new UncheckedIOException("Vector search failed", e);
    }
  }

  @SuppressWarnings("unused")
  private List<ArchiveChunkDocument> vectorSearchFallback(
      UUID userId, List<Float> queryEmbedding, int topK, Throwable t) {
    log.warn("Vector search fallback for user {}: {}", userId, t.getMessage());
    meterRegistry.counter(getMetricPrefix() + ".vector_search.fallback").increment();
    return List.of();
  }

  /** Removes every indexed chunk of one archive. */
  @Timed(value = "elasticsearch.delete_by", description = "Time to delete archive chunks")
  public void deleteByArchiveId(UUID archiveId) {
    Query query = Query.of(q -> q.term(t -> t.field("archiveId").value(archiveId.toString())));
    try {
      executeDelete(query);
    } catch (IOException e) {
      throw new UncheckedIOException("Failed to delete chunks of archive " + archiveId, e);
    }
  }

  private static Query userFilter(UUID userId) {
    return Query.of(q -> q.term(t -> t.field("userId").value(userId.toString())));
  }
}
