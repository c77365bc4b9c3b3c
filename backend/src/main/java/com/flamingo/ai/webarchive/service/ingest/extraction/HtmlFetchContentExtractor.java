package com.flamingo.ai.webarchive.service.ingest.extraction;

import com.flamingo.ai.webarchive.config.ArchiveConfig;
import com.flamingo.ai.webarchive.exception.ExtractionException;
import java.io.IOException;
import java.util.List;
import java.util.Locale;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.jsoup.HttpStatusException;
import org.jsoup.Jsoup;
import org.jsoup.nodes.Document;
import org.jsoup.nodes.Element;
import org.springframework.stereotype.Component;

/**
 * Downloads a page and extracts its text with Jsoup.
 *
 * <p>Error pages and pages with too little text are rejected so they are not archived as content.
 */
@Component
@RequiredArgsConstructor
@Slf4j
public class HtmlFetchContentExtractor implements ContentExtractor {

  static final String METHOD = "fetch";

  private static final List<String> ERROR_TITLE_MARKERS =
      List.of("404", "not found", "access denied", "forbidden", "unauthorized");
  private static final List<String> ERROR_BODY_MARKERS =
      List.of(
          "page not found",
          "this page doesn't exist",
          "access denied",
          "403 forbidden",
          "401 unauthorized");

  private final ArchiveConfig archiveConfig;

  @Override
  public ExtractedContent extract(String url) {
    ArchiveConfig.Extraction.Fetch fetch = archiveConfig.getExtraction().getFetch();
    Document document;
    try {
      document =
          Jsoup.connect(url)
              .userAgent(fetch.getUserAgent())
              .timeout(fetch.getTimeoutMs())
              .followRedirects(true)
              .get();
    } catch (HttpStatusException e) {
      throw new ExtractionException(url, "HTTP " + e.getStatusCode(), e);
    } catch (IOException e) {
      throw new ExtractionException(url, "Fetch failed: " + e.getMessage(), e);
    }
    return extractFrom(url, document);
  }

  /** Extracts content from an already parsed page. */
  ExtractedContent extractFrom(String url, Document document) {
    ArchiveConfig.Extraction.Fetch fetch = archiveConfig.getExtraction().getFetch();
    String html = document.outerHtml();
    String title = document.title();
    if (title.isBlank()) {
      Element h1 = document.selectFirst("h1");
      title = h1 != null ? h1.text() : "";
    }
    String description = metaContent(document, "meta[name=description]");
    if (description.isEmpty()) {
      description = metaContent(document, "meta[property=og:description]");
    }

    rejectErrorPage(url, title, document.body() != null ? document.body().text() : "");

    document.select("script, style, noscript").remove();
    String text =
        document.body() != null ? document.body().text().replaceAll("\\s+", " ").trim() : "";
    if (text.length() < fetch.getMinTextLength()) {
      throw new ExtractionException(url, "Content too short to be valuable");
    }
    int wordCount = ExtractedContent.countWords(text);
    if (wordCount < fetch.getMinWordCount()) {
      throw new ExtractionException(url, "Content has too few meaningful words");
    }
    if (text.length() > fetch.getMaxTextLength()) {
      text = text.substring(0, fetch.getMaxTextLength());
    }

    log.debug("Fetched {} ({} words)", url, wordCount);
    return new ExtractedContent(
        title,
        description,
        html,
        null,
        text,
        wordCount,
        ExtractedContent.readingMinutes(wordCount),
        METHOD);
  }

  private static void rejectErrorPage(String url, String title, String bodyText) {
    String titleLower = title.toLowerCase(Locale.ROOT);
    String bodyLower = bodyText.toLowerCase(Locale.ROOT);
    boolean errorPage =
        ERROR_TITLE_MARKERS.stream().anyMatch(titleLower::contains)
            || ERROR_BODY_MARKERS.stream().anyMatch(bodyLower::contains);
    if (errorPage) {
      throw new ExtractionException(url, "Content appears to be an error page");
    }
  }

  private static String metaContent(Document document, String selector) {
    Element meta = document.selectFirst(selector);
    return meta != null ? meta.attr("content").trim() : "";
  }
}
