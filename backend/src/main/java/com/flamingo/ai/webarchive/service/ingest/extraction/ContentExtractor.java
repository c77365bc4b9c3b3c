package com.flamingo.ai.webarchive.service.ingest.extraction;

import com.flamingo.ai.webarchive.exception.ExtractionException;

/** Turns a URL into archivable content. */
public interface ContentExtractor {

  /**
   * Extracts the page behind {@code url}.
   *
   * @throws ExtractionException on timeouts, non-success responses, empty or low-quality content
   */
  ExtractedContent extract(String url);
}
