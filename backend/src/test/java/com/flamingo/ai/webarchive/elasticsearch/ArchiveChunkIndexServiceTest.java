package com.flamingo.ai.webarchive.elasticsearch;

import static org.assertj.core.api.Assertions.assertThat;

import co.elastic.clients.elasticsearch.ElasticsearchClient;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import java.util.List;
import java.util.Map;
import java.util.UUID;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

@ExtendWith(MockitoExtension.class)
class ArchiveChunkIndexServiceTest {

  @Mock private ElasticsearchClient elasticsearchClient;

  private ArchiveChunkIndexService indexService;

  @BeforeEach
  void setUp() {
    indexService =
        new ArchiveChunkIndexService(
            elasticsearchClient, new SimpleMeterRegistry(), "test-archive-chunks", 3);
  }

  @Test
  @DisplayName("should map a dense vector with the configured dimensions")
  void shouldDefineVectorMapping() {
    var properties = indexService.defineIndexProperties();

    assertThat(properties.get("embedding").denseVector().dims()).isEqualTo(3);
    assertThat(properties.get("userId").isKeyword()).isTrue();
    assertThat(properties.get("content").isText()).isTrue();
  }

  @Test
  @DisplayName("should leave the vector out of documents without one")
  void shouldOmitMissingVector() {
    ArchiveChunkDocument chunk = chunk(null);

    Map<String, Object> document = indexService.convertToDocument(chunk);

    assertThat(document).doesNotContainKey("embedding");
    assertThat(document.get("userId")).isEqualTo(chunk.getUserId().toString());
    assertThat(indexService.getDocumentId(chunk))
        .isEqualTo(chunk.getArchiveId() + "_" + chunk.getChunkIndex());
  }

  @Test
  @DisplayName("should read a stored document back with its score")
  void shouldConvertFromSource() {
    ArchiveChunkDocument chunk = chunk(List.of(0.1f, 0.2f, 0.3f));
    Map<String, Object> source = indexService.convertToDocument(chunk);

    ArchiveChunkDocument read = indexService.convertFromDocument("doc-1", source, 2.5);

    assertThat(read.getId()).isEqualTo("doc-1");
    assertThat(read.getArchiveId()).isEqualTo(chunk.getArchiveId());
    assertThat(read.getContentId()).isEqualTo(chunk.getContentId());
    assertThat(read.getTags()).containsExactly("ai");
    assertThat(read.getChunkIndex()).isEqualTo(4);
    assertThat(read.getRelevanceScore()).isEqualTo(2.5);
  }

  private static ArchiveChunkDocument chunk(List<Float> embedding) {
    return ArchiveChunkDocument.builder()
        .userId(UUID.randomUUID())
        .archiveId(UUID.randomUUID())
        .contentId(UUID.randomUUID())
        .url("https://example.com")
        .title("Title")
        .tags(List.of("ai"))
        .chunkIndex(4)
        .content("chunk text")
        .embedding(embedding)
        .build();
  }
}
