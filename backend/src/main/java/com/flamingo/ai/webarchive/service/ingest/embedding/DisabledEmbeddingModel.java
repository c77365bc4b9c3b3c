package com.flamingo.ai.webarchive.service.ingest.embedding;

import com.flamingo.ai.webarchive.exception.EmbeddingUnavailableException;
import dev.langchain4j.data.embedding.Embedding;
import dev.langchain4j.data.segment.TextSegment;
import dev.langchain4j.model.embedding.EmbeddingModel;
import dev.langchain4j.model.output.Response;
import java.util.List;

/** Null-object embedding model used when no embedding provider is configured. */
public class DisabledEmbeddingModel implements EmbeddingModel {

  @Override
  public Response<List<Embedding>> embedAll(List<TextSegment> textSegments) {
    throw new EmbeddingUnavailableException("Embedding provider is not configured");
  }
}
