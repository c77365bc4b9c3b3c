package com.flamingo.ai.webarchive.service.ingest.extraction;

import java.util.Optional;
import java.util.regex.Pattern;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;

/**
 * Extracts pages through Firecrawl and falls back to a plain fetch when Firecrawl has nothing.
 *
 * <p>Firecrawl markdown is stripped of boilerplate (navigation, ads, newsletter forms, share
 * links) before a plain-text rendition is derived from it.
 */
@RequiredArgsConstructor
@Slf4j
public class FirecrawlContentExtractor implements ContentExtractor {

  static final String METHOD = "firecrawl";
  static final String FALLBACK_METHOD = "fetch-fallback";

  private static final Pattern EXCESS_NEWLINES = Pattern.compile("\\n{3,}");
  private static final Pattern BOILERPLATE_BLOCK =
      Pattern.compile("(?m)^(Navigation|Menu|Footer|Sidebar)[\\s\\S]*?$");
  private static final Pattern AD_MARKERS = Pattern.compile("\\[(Advertisement|Sponsored)]");
  private static final Pattern NEWSLETTER_FORM =
      Pattern.compile(
          "Loading[\\s\\S]*?You will now start receiving email updates[\\s\\S]*?Sign Up");
  private static final Pattern SKIP_LINK = Pattern.compile("Skip to Main Content\\s*");
  private static final Pattern SHARE_LIST_ITEM = Pattern.compile("- \\[.*?]\\(.*?\\)");

  private static final Pattern CODE_BLOCK = Pattern.compile("```[\\s\\S]*?```");
  private static final Pattern INLINE_CODE = Pattern.compile("`[^`]*`");
  private static final Pattern LINK = Pattern.compile("\\[([^\\]]*)]\\([^)]*\\)");
  private static final Pattern FORMATTING = Pattern.compile("[#*_`]");
  private static final Pattern NEWLINES = Pattern.compile("\\n+");

  private final FirecrawlClient firecrawlClient;
  private final HtmlFetchContentExtractor fallback;

  @Override
  public ExtractedContent extract(String url) {
    Optional<FirecrawlClient.ScrapeData> scraped = firecrawlClient.scrape(url);
    if (scraped.isEmpty()) {
      log.info("Firecrawl had no content for {}, falling back to fetch", url);
      ExtractedContent fetched = fallback.extract(url);
      return new ExtractedContent(
          fetched.title(),
          fetched.description(),
          fetched.html(),
          fetched.markdown(),
          fetched.text(),
          fetched.wordCount(),
          fetched.readingTime(),
          FALLBACK_METHOD);
    }

    FirecrawlClient.ScrapeData data = scraped.get();
    String markdown = cleanMarkdown(data.markdown());
    String text = toPlainText(markdown);
    int wordCount = ExtractedContent.countWords(text);
    FirecrawlClient.Metadata metadata = data.metadata();
    String title = metadata != null && metadata.title() != null ? metadata.title() : "";
    String description = "";
    if (metadata != null) {
      description =
          metadata.description() != null && !metadata.description().isBlank()
              ? metadata.description()
              : (metadata.ogDescription() != null ? metadata.ogDescription() : "");
    }
    return new ExtractedContent(
        title,
        description,
        data.html() != null ? data.html() : "",
        markdown,
        text,
        wordCount,
        ExtractedContent.readingMinutes(wordCount),
        METHOD);
  }

  static String cleanMarkdown(String markdown) {
    String cleaned = EXCESS_NEWLINES.matcher(markdown).replaceAll("\n\n");
    cleaned = BOILERPLATE_BLOCK.matcher(cleaned).replaceAll("");
    cleaned = AD_MARKERS.matcher(cleaned).replaceAll("");
    cleaned = NEWSLETTER_FORM.matcher(cleaned).replaceAll("");
    cleaned = SKIP_LINK.matcher(cleaned).replaceAll("");
    return SHARE_LIST_ITEM.matcher(cleaned).replaceAll("");
  }

  static String toPlainText(String markdown) {
    String text = CODE_BLOCK.matcher(markdown).replaceAll("");
    text = INLINE_CODE.matcher(text).replaceAll("");
    text = LINK.matcher(text).replaceAll("$1");
    text = FORMATTING.matcher(text).replaceAll("");
    return NEWLINES.matcher(text).replaceAll(" ").trim();
  }
}
