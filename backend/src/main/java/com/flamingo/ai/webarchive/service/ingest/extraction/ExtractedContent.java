package com.flamingo.ai.webarchive.service.ingest.extraction;

/**
 * Content extracted from one page.
 *
 * @param markdown null when the strategy does not produce markdown
 * @param readingTime estimated minutes at 200 words per minute
 * @param extractionMethod name of the strategy that produced the content
 */
public record ExtractedContent(
    String title,
    String description,
    String html,
    String markdown,
    String text,
    int wordCount,
    int readingTime,
    String extractionMethod) {

  static int countWords(String text) {
    String trimmed = text == null ? "" : text.trim();
    return trimmed.isEmpty() ? 0 : trimmed.split("\\s+").length;
  }

  static int readingMinutes(int wordCount) {
    return (int) Math.ceil(wordCount / 200.0);
  }
}
