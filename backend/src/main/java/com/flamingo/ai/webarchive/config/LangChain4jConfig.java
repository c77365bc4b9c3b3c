package com.flamingo.ai.webarchive.config;

import com.flamingo.ai.webarchive.service.ingest.embedding.DisabledEmbeddingModel;
import dev.langchain4j.model.embedding.EmbeddingModel;
import dev.langchain4j.model.openai.OpenAiEmbeddingModel;
import java.time.Duration;
import lombok.extern.slf4j.Slf4j;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

/**
 * Configuration for the LangChain4j embedding model.
 *
 * <p>The provider is chosen by {@code archive.embedding.provider}. When it is {@code none}, or the
 * OpenAI key is missing, a {@link DisabledEmbeddingModel} is registered and every chunk is stored
 * without a vector (lexical-only search).
 */
@Configuration
@Slf4j
public class LangChain4jConfig {

  @Bean
  public EmbeddingModel embeddingModel(ArchiveConfig archiveConfig) {
    ArchiveConfig.Embedding embedding = archiveConfig.getEmbedding();

    if ("none".equalsIgnoreCase(embedding.getProvider())) {
      log.info("Embedding provider disabled by configuration, search will be lexical only");
      return new DisabledEmbeddingModel();
    }
    if (embedding.getApiKey() == null || embedding.getApiKey().isBlank()) {
      log.warn("OpenAI API key not configured, skipping embeddings (lexical-only search)");
      return new DisabledEmbeddingModel();
    }

    log.info(
        "Embedding provider: openai, model={}, dimensions={}",
        embedding.getModelName(),
        embedding.getDimensions());
    return OpenAiEmbeddingModel.builder()
        .apiKey(embedding.getApiKey())
        .modelName(embedding.getModelName())
        .dimensions(embedding.getDimensions())
        .timeout(Duration.ofSeconds(embedding.getTimeoutSeconds()))
        .build();
  }
}
