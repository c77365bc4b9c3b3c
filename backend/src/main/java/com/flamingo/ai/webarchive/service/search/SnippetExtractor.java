package com.flamingo.ai.webarchive.service.search;

import com.flamingo.ai.webarchive.config.ArchiveConfig;
import java.util.Arrays;
import java.util.Comparator;
import java.util.List;
import java.util.Locale;
import java.util.regex.Matcher;
import java.util.regex.Pattern;
import java.util.stream.Collectors;
import lombok.RequiredArgsConstructor;
import org.springframework.stereotype.Component;

/** Picks the passage of a document that best matches a query and marks the query terms in it. */
@Component
@RequiredArgsConstructor
public class SnippetExtractor {

  static final String ELLIPSIS = "...";
  private static final int MIN_TERM_LENGTH = 3;
  /** Windows starting in the last stretch of this many characters are not scored. */
  private static final int TAIL_SKIP = 100;

  private final ArchiveConfig archiveConfig;

  /** Distinct lower-cased query words longer than two characters. */
  public List<String> queryTerms(String query) {
    if (query == null || query.isBlank()) {
      return List.of();
    }
    return Arrays.stream(query.toLowerCase(Locale.ROOT).trim().split("\\s+"))
        .filter(term -> term.length() >= MIN_TERM_LENGTH)
        .distinct()
        .toList();
  }

  /**
   * Returns the window containing the most distinct query terms, widened to whole words when a
   * space is close and wrapped in ellipses where text was cut. Ties keep the earliest window.
   */
  public String snippet(String text, List<String> terms) {
    if (text == null || text.isEmpty()) {
      return "";
    }
    ArchiveConfig.Search search = archiveConfig.getSearch();
    int windowLength = search.getSnippetLength();
    String lower = text.toLowerCase(Locale.ROOT);

    int bestPos = 0;
    int bestScore = 0;
    for (int i = 0; i < text.length() - TAIL_SKIP; i += search.getSnippetStep()) {
      String window = lower.substring(i, Math.min(lower.length(), i + windowLength));
      int score = (int) terms.stream().filter(window::contains).count();
      if (score > bestScore) {
        bestScore = score;
        bestPos = i;
      }
    }

    // widen only, so terms counted inside the window are never cut
    int boundary = search.getBoundaryWindow();
    int start = bestPos;
    int end = Math.min(text.length(), start + windowLength);
    if (start > 0) {
      int space = text.lastIndexOf(' ', start - 1);
      if (space != -1 && space >= start - boundary) {
        start = space + 1;
      }
    }
    if (end < text.length()) {
      int space = text.indexOf(' ', end);
      if (space != -1 && space <= end + boundary) {
        end = space;
      }
    }

    String snippet = text.substring(start, end).trim();
    if (start > 0) {
      snippet = ELLIPSIS + snippet;
    }
    if (end < text.length()) {
      snippet = snippet + ELLIPSIS;
    }
    return snippet;
  }

  /** Wraps every case-insensitive occurrence of a term in {@code **}. */
  public String highlight(String text, List<String> terms) {
    if (text == null || text.isEmpty() || terms.isEmpty()) {
      return text;
    }
    // longest first so a term is never split by a shorter one it contains
    String alternation =
        terms.stream()
            .sorted(Comparator.comparingInt(String::length).reversed())
            .map(Pattern::quote)
            .collect(Collectors.joining("|"));
    Matcher matcher =
        Pattern.compile("(" + alternation + ")", Pattern.CASE_INSENSITIVE | Pattern.UNICODE_CASE)
            .matcher(text);
    return matcher.replaceAll(match -> Matcher.quoteReplacement("**" + match.group(1) + "**"));
  }

  /** Highlighted head of a matching chunk. */
  public String excerpt(String chunkText, List<String> terms) {
    if (chunkText == null) {
      return "";
    }
    int length = archiveConfig.getSearch().getChunkExcerptLength();
    return highlight(chunkText.substring(0, Math.min(chunkText.length(), length)), terms);
  }
}
