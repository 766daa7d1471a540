package com.flamingo.ai.linkextractor.config;

import lombok.Getter;
import lombok.Setter;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.context.annotation.Configuration;

/** Configuration properties for the link extraction pipeline. */
@Configuration
@ConfigurationProperties(prefix = "link-extractor")
@Getter
@Setter
public class LinkExtractorConfig {

  private Source source = new Source();
  private Fetch fetch = new Fetch();
  private Pdf pdf = new Pdf();
  private Pipeline pipeline = new Pipeline();
  private Summary summary = new Summary();
  private Refetch refetch = new Refetch();

  @Getter
  @Setter
  public static class Source {
    /** Root of the daily notes tree. Required; usually set through DAILY_NOTES_PATH. */
    private String notesPath;

    /** Extension of daily note files, without the dot. */
    private String fileExtension = "md";

    /** Heading line that opens the links section of a note. */
    private String sectionHeading = "## Links";
  }

  @Getter
  @Setter
  public static class Fetch {
    /** Maximum requests per second to a single host. */
    private double requestsPerSecond = 1.0;

    private int timeoutSeconds = 30;

    /** Maximum number of body bytes read from an HTML response. */
    private int maxContentLength = 1_000_000;

    /** Maximum length of the readable text kept from a page. */
    private int extractedTextMaxLength = 10_000;

    private String userAgent = "ObsidianLinkExtractor/1.0";
  }

  @Getter
  @Setter
  public static class Pdf {
    private int timeoutSeconds = 60;
    private int maxPages = 50;
    private int maxContentLength = 50_000;
  }

  @Getter
  @Setter
  public static class Pipeline {
    /** Number of links each stage handles per run. */
    private int batchSize = 50;

    /** Skip source files whose content hash is unchanged since the last run. */
    private boolean skipExisting = true;
  }

  @Getter
  @Setter
  public static class Summary {
    /** Page content sent to the model is cut to this many characters. */
    private int maxInputChars = 8_000;
  }

  @Getter
  @Setter
  public static class Refetch {
    /** Successful fetches with less extracted text than this are refetch candidates. */
    private int minContentLength = 50;

    private int defaultLimit = 1_000;
  }
}
