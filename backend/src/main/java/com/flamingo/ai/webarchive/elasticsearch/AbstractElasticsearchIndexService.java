package com.flamingo.ai.webarchive.elasticsearch;

import co.elastic.clients.elasticsearch.ElasticsearchClient;
import co.elastic.clients.elasticsearch._types.mapping.DynamicMapping;
import co.elastic.clients.elasticsearch._types.mapping.Property;
import co.elastic.clients.elasticsearch._types.query_dsl.Query;
import co.elastic.clients.elasticsearch.core.BulkRequest;
import co.elastic.clients.elasticsearch.core.BulkResponse;
import co.elastic.clients.elasticsearch.core.SearchRequest;
import co.elastic.clients.elasticsearch.core.SearchResponse;
import co.elastic.clients.elasticsearch.core.search.Hit;
import io.micrometer.core.instrument.MeterRegistry;
import jakarta.annotation.PostConstruct;
import java.io.IOException;
import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import lombok.extern.slf4j.Slf4j;

/**
 * Base class for services owning one Elasticsearch index.
 *
 * <p>Handles index creation and mapping upgrades, bulk indexing, search execution and
 * delete-by-query. Subclasses describe the schema and the document conversion and expose the
 * typed, resilience-wrapped operations.
 *
 * @param <T> the document type stored in the index
 */
@Slf4j
public abstract class AbstractElasticsearchIndexService<T> {

  protected final ElasticsearchClient elasticsearchClient;
  protected final MeterRegistry meterRegistry;

  protected AbstractElasticsearchIndexService(
      ElasticsearchClient elasticsearchClient, MeterRegistry meterRegistry) {
    this.elasticsearchClient = elasticsearchClient;
    this.meterRegistry = meterRegistry;
  }

  public abstract String getIndexName();

  protected abstract Map<String, Property> defineIndexProperties();

  protected abstract Map<String, Object> convertToDocument(T entity);

  /**
   * Rebuilds a document from its stored source.
   *
   * @param id the Elasticsearch {@code _id}, which is not part of the source
   * @param score the hit score, or null outside of a search
   */
  protected abstract T convertFromDocument(String id, Map<String, Object> source, Double score);

  protected abstract String getDocumentId(T entity);

  /** Prefix for this index's counters, e.g. "archive_chunk". */
  protected abstract String getMetricPrefix();

  @PostConstruct
  public void initIndex() {
    try {
      var indices = elasticsearchClient.indices();
      if (indices == null) {
        log.warn("Elasticsearch client not available, skipping init of {}", getIndexName());
        return;
      }
      if (indices.exists(e -> e.index(getIndexName())).value()) {
        addMissingMappings();
      } else {
        Map<String, Property> properties = defineIndexProperties();
        indices.create(
            c ->
                c.index(getIndexName())
                    .mappings(m -> m.dynamic(DynamicMapping.False).properties(properties)));
        log.info("Created Elasticsearch index: {}", getIndexName());
      }
    } catch (IOException e) {
      throw new IllegalStateException(
          "Failed to initialize Elasticsearch index '" + getIndexName() + "'", e);
    }
  }

  /**
   * Adds fields declared by the schema but missing from the live index. A field whose type changed
   * cannot be migrated in place, so startup fails and the index has to be recreated.
   */
  private void addMissingMappings() throws IOException {
    Map<String, Property> expected = defineIndexProperties();
    var mapping = elasticsearchClient.indices().getMapping(g -> g.index(getIndexName()));
    var indexMapping = mapping.get(getIndexName());
    if (indexMapping == null) {
      return;
    }
    Map<String, Property> actual = indexMapping.mappings().properties();

    Map<String, Property> missing = new HashMap<>();
    for (Map.Entry<String, Property> entry : expected.entrySet()) {
      Property live = actual.get(entry.getKey());
      if (live == null) {
        missing.put(entry.getKey(), entry.getValue());
      } else if (live._kind() != entry.getValue()._kind()) {
        throw new IllegalStateException(
            String.format(
                "Index '%s' field '%s' is mapped as '%s' but '%s' is required; "
                    + "delete the index and restart",
                getIndexName(), entry.getKey(), live._kind(), entry.getValue()._kind()));
      }
    }

    if (!missing.isEmpty()) {
      elasticsearchClient.indices().putMapping(p -> p.index(getIndexName()).properties(missing));
      log.info(
          "Added {} field(s) to index '{}': {}", missing.size(), getIndexName(), missing.keySet());
    }
  }

  /** Bulk-indexes documents, overwriting any document with the same id. */
  protected void bulkIndex(List<T> documents) throws IOException {
    if (documents.isEmpty()) {
      return;
    }
    BulkRequest.Builder bulk = new BulkRequest.Builder();
    for (T document : documents) {
      String id = getDocumentId(document);
      Map<String, Object> source = convertToDocument(document);
      bulk.operations(op -> op.index(idx -> idx.index(getIndexName()).id(id).document(source)));
    }

    BulkResponse response = elasticsearchClient.bulk(bulk.build());
    if (response.errors()) {
      long failed = response.items().stream().filter(item -> item.error() != null).count();
      log.warn(
          "{} of {} documents failed to index in {}", failed, documents.size(), getIndexName());
      meterRegistry.counter(getMetricPrefix() + ".index.errors").increment(failed);
    } else {
      log.debug("Indexed {} documents to {}", documents.size(), getIndexName());
      meterRegistry.counter(getMetricPrefix() + ".indexed").increment(documents.size());
    }
  }

  @SuppressWarnings({"rawtypes", "unchecked"})
  protected List<T> executeSearch(SearchRequest request, String searchType) throws IOException {
    SearchResponse<Map> response = elasticsearchClient.search(request, Map.class);
    List<Hit<Map>> hits = response.hits().hits();
    log.debug("[{}] index={} returned={}", searchType, getIndexName(), hits.size());

    List<T> documents = new ArrayList<>(hits.size());
    for (Hit<Map> hit : hits) {
      Map<String, Object> source = hit.source();
      if (source != null) {
        documents.add(convertFromDocument(hit.id(), source, hit.score()));
      }
    }
    meterRegistry.counter(getMetricPrefix() + "." + searchType).increment();
    return documents;
  }

  protected void executeDelete(Query query) throws IOException {
    var response = elasticsearchClient.deleteByQuery(d -> d.index(getIndexName()).query(query));
    log.info("Deleted {} documents from {}", response.deleted(), getIndexName());
    meterRegistry.counter(getMetricPrefix() + ".deleted").increment();
  }

  public void refresh() {
    try {
      elasticsearchClient.indices().refresh(r -> r.index(getIndexName()));
    } catch (IOException e) {
      log.warn("Failed to refresh index {}: {}", getIndexName(), e.getMessage());
    }
  }
}
