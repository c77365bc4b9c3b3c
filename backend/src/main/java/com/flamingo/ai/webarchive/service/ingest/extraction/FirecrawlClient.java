package com.flamingo.ai.webarchive.service.ingest.extraction;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.flamingo.ai.webarchive.config.ArchiveConfig;
import io.github.resilience4j.circuitbreaker.annotation.CircuitBreaker;
import io.micrometer.core.instrument.MeterRegistry;
import java.time.Duration;
import java.util.List;
import java.util.Optional;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.HttpHeaders;
import org.springframework.http.MediaType;
import org.springframework.stereotype.Component;
import org.springframework.web.reactive.function.client.WebClient;

/** HTTP client for the Firecrawl scrape endpoint. */
@Component
@Slf4j
public class FirecrawlClient {

  private final WebClient webClient;
  private final ArchiveConfig.Extraction.Firecrawl settings;
  private final MeterRegistry meterRegistry;

  public FirecrawlClient(ArchiveConfig archiveConfig, MeterRegistry meterRegistry) {
    this.settings = archiveConfig.getExtraction().getFirecrawl();
    this.meterRegistry = meterRegistry;
    this.webClient =
        WebClient.builder()
            .baseUrl(settings.getBaseUrl())
            .defaultHeader(HttpHeaders.AUTHORIZATION, "Bearer " + settings.getApiKey())
            .codecs(configurer -> configurer.defaultCodecs().maxInMemorySize(16 * 1024 * 1024))
            .build();
  }

  public boolean isConfigured() {
    return settings.getApiKey() != null && !settings.getApiKey().isBlank();
  }

  /**
   * Scrapes the main content of a page as markdown and html.
   *
   * @return empty when Firecrawl returned no markdown or is unavailable
   */
  @CircuitBreaker(name = "firecrawl", fallbackMethod = "scrapeFallback")
  public Optional<ScrapeData> scrape(String url) {
    ScrapeRequest request =
        new ScrapeRequest(
            url,
            List.of("markdown", "html"),
            true,
            settings.getWaitForMs(),
            settings.getTimeoutMs(),
            true);
    ScrapeResponse response =
        webClient
            .post()
            .uri("/v1/scrape")
            .contentType(MediaType.APPLICATION_JSON)
            .bodyValue(request)
            .retrieve()
            .bodyToMono(ScrapeResponse.class)
            // Firecrawl's own timeout plus headroom for the round trip
            .timeout(Duration.ofMillis(settings.getTimeoutMs() + 5000L))
            .block();
    if (response == null || response.data() == null || response.data().markdown() == null) {
      log.warn("Firecrawl returned no content for {}", url);
      return Optional.empty();
    }
    meterRegistry.counter("extraction.firecrawl.success").increment();
    return Optional.of(response.data());
  }

  @SuppressWarnings("unused")
  private Optional<ScrapeData> scrapeFallback(String url, Throwable t) {
    log.warn("Firecrawl scrape failed for {}: {}", url, t.getMessage());
    meterRegistry.counter("extraction.firecrawl.failure").increment();
    return Optional.empty();
  }

  record ScrapeRequest(
      String url,
      List<String> formats,
      boolean onlyMainContent,
      int waitFor,
      int timeout,
      boolean removeBase64Images) {}

  @JsonIgnoreProperties(ignoreUnknown = true)
  record ScrapeResponse(boolean success, ScrapeData data) {}

  /** The scraped page. */
  @JsonIgnoreProperties(ignoreUnknown = true)
  public record ScrapeData(String markdown, String html, Metadata metadata) {}

  /** Page metadata reported by Firecrawl. */
  @JsonIgnoreProperties(ignoreUnknown = true)
  public record Metadata(String title, String description, String ogDescription) {}
}
