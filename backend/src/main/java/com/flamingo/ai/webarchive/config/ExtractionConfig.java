package com.flamingo.ai.webarchive.config;

import com.flamingo.ai.webarchive.service.ingest.extraction.ContentExtractor;
import com.flamingo.ai.webarchive.service.ingest.extraction.FirecrawlClient;
import com.flamingo.ai.webarchive.service.ingest.extraction.FirecrawlContentExtractor;
import com.flamingo.ai.webarchive.service.ingest.extraction.HtmlFetchContentExtractor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.context.annotation.Primary;

/** Selects the content extraction strategy from {@code archive.extraction.provider}. */
@Configuration
@Slf4j
public class ExtractionConfig {

  @Bean
  @Primary
  public ContentExtractor contentExtractor(
      ArchiveConfig archiveConfig,
      HtmlFetchContentExtractor htmlFetchContentExtractor,
      FirecrawlClient firecrawlClient) {
    String provider = archiveConfig.getExtraction().getProvider();
    if ("firecrawl".equalsIgnoreCase(provider)) {
      if (firecrawlClient.isConfigured()) {
        log.info("Content extraction: firecrawl with fetch fallback");
        return new FirecrawlContentExtractor(firecrawlClient, htmlFetchContentExtractor);
      }
      log.warn("Firecrawl API key not configured, using fetch extraction");
    }
    log.info("Content extraction: fetch");
    return htmlFetchContentExtractor;
  }
}
