package com.flamingo.ai.webarchive.service.ingest.embedding;

import com.flamingo.ai.webarchive.config.ArchiveConfig;
import dev.langchain4j.data.embedding.Embedding;
import dev.langchain4j.model.embedding.EmbeddingModel;
import dev.langchain4j.model.output.Response;
import io.github.resilience4j.circuitbreaker.annotation.CircuitBreaker;
import io.github.resilience4j.retry.annotation.Retry;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.Timer;
import java.util.ArrayList;
import java.util.List;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

/**
 * Calls the configured embedding provider.
 *
 * <p>Never throws: an empty list means "no vector available" (provider disabled, failing, or its
 * circuit open) and callers fall back to keyword-only behaviour.
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class EmbeddingService {

  private final EmbeddingModel embeddingModel;
  private final ArchiveConfig archiveConfig;
  private final MeterRegistry meterRegistry;

  public boolean isEnabled() {
    return !(embeddingModel instanceof DisabledEmbeddingModel);
  }

  /** Embeds a stored chunk. */
  @CircuitBreaker(name = "embedding", fallbackMethod = "embedFallback")
  @Retry(name = "embedding")
  public List<Float> embedPassage(String text) {
    return embed(text, "passage");
  }

  /** Embeds a search query. */
  @CircuitBreaker(name = "embedding", fallbackMethod = "embedFallback")
  @Retry(name = "embedding")
  public List<Float> embedQuery(String text) {
    return embed(text, "query");
  }

  private List<Float> embed(String text, String kind) {
    if (!isEnabled() || text == null || text.isBlank()) {
      return List.of();
    }
    int maxChars = archiveConfig.getEmbedding().getMaxChars();
    if (text.length() > maxChars) {
      log.debug("Truncating {} text from {} to {} chars", kind, text.length(), maxChars);
      text = text.substring(0, maxChars);
    }

    Timer.Sample sample = Timer.start(meterRegistry);
    try {
      Response<Embedding> response = embeddingModel.embed(text);
      meterRegistry.counter("embedding.requests.success", "kind", kind).increment();
      float[] vector = response.content().vector();
      List<Float> result = new ArrayList<>(vector.length);
      for (float f : vector) {
        result.add(f);
      }
      return result;
    } finally {
      sample.stop(meterRegistry.timer("embedding.duration", "kind", kind));
    }
  }

  @SuppressWarnings("unused")
  private List<Float> embedFallback(String text, Throwable t) {
    log.warn("Embedding unavailable, continuing without vector: {}", t.getMessage());
    meterRegistry.counter("embedding.requests.failure").increment();
    return List.of();
  }
}
