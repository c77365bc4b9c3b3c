package com.flamingo.ai.webarchive.config;

import lombok.Getter;
import lombok.Setter;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.context.annotation.Configuration;

/** Configuration properties for the archive ingestion and search pipeline. */
@Configuration
@ConfigurationProperties(prefix = "archive")
@Getter
@Setter
public class ArchiveConfig {

  private Chunking chunking = new Chunking();
  private Importing importing = new Importing();
  private Search search = new Search();
  private Extraction extraction = new Extraction();
  private Embedding embedding = new Embedding();

  @Getter
  @Setter
  public static class Chunking {
    private int size = 1500;
    private int overlap = 300;
  }

  @Getter
  @Setter
  public static class Importing {
    private int batchSize = 3;
    private long delayBetweenBatchesMs = 2000;
    private long delayBetweenRequestsMs = 1000;
    private int maxRetries = 2;

    /** Largest accepted batch size; the item pool keeps this many workers per running job. */
    private int maxBatchSize = 10;

    /** Jobs that may run at the same time; later jobs wait in the job queue. */
    private int maxConcurrentJobs = 4;

    /** Number of URLs per existence query when checking for duplicates. */
    private int duplicateCheckBatchSize = 100;

    /** Upper bound on URLs accepted by a single import. */
    private int maxUrlsPerImport = 5000;

    private int previewSize = 10;
    private int duplicatePreviewSize = 5;

    /** Window used by the import status view. */
    private int recentWindowHours = 24;
  }

  @Getter
  @Setter
  public static class Search {
    private int snippetLength = 300;
    private int snippetStep = 50;

    /** Max distance a snippet edge may move to land on a word boundary. */
    private int boundaryWindow = 20;

    private int chunkExcerptLength = 200;
    private int defaultLimit = 20;

    /** Number of raw hits requested from the index per search. */
    private int candidateCount = 30;

    private int rrfK = 60;
  }

  @Getter
  @Setter
  public static class Extraction {
    /** Extraction strategy: "fetch" (default, Jsoup) or "firecrawl". */
    private String provider = "fetch";

    private Fetch fetch = new Fetch();
    private Firecrawl firecrawl = new Firecrawl();

    @Getter
    @Setter
    public static class Fetch {
      private int timeoutMs = 30000;
      private String userAgent =
          "Mozilla/5.0 (Windows NT 10.0; Win64; x64) AppleWebKit/537.36 (KHTML, like Gecko)";
      private int maxTextLength = 50000;
      private int minTextLength = 100;
      private int minWordCount = 20;
    }

    @Getter
    @Setter
    public static class Firecrawl {
      private String baseUrl = "https://api.firecrawl.dev";
      private String apiKey = "";
      private int timeoutMs = 30000;

      /** Milliseconds Firecrawl waits for client-side rendering before scraping. */
      private int waitForMs = 3000;
    }
  }

  @Getter
  @Setter
  public static class Embedding {
    /** Embedding provider: "openai" or "none". */
    private String provider = "openai";

    private String apiKey = "";
    private String modelName = "text-embedding-3-small";
    private int dimensions = 768;
    private int timeoutSeconds = 30;

    /** Text longer than this is truncated before it is sent to the provider. */
    private int maxChars = 10000;
  }
}
