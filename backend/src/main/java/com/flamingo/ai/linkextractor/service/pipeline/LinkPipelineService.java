package com.flamingo.ai.linkextractor.service.pipeline;

import com.flamingo.ai.linkextractor.config.LinkExtractorConfig;
import com.flamingo.ai.linkextractor.domain.entity.LinkRecord;
import com.flamingo.ai.linkextractor.domain.enums.TagSource;
import com.flamingo.ai.linkextractor.exception.PipelineBusyException;
import com.flamingo.ai.linkextractor.exception.PipelineConfigurationException;
import com.flamingo.ai.linkextractor.service.enrichment.Summarizer;
import com.flamingo.ai.linkextractor.service.enrichment.TagSuggestion;
import com.flamingo.ai.linkextractor.service.enrichment.Tagger;
import com.flamingo.ai.linkextractor.service.extraction.ExtractedLink;
import com.flamingo.ai.linkextractor.service.extraction.LinkParser;
import com.flamingo.ai.linkextractor.service.extraction.SourceFile;
import com.flamingo.ai.linkextractor.service.extraction.SourceScanner;
import com.flamingo.ai.linkextractor.service.fetch.DocumentFetcher;
import com.flamingo.ai.linkextractor.service.fetch.FetchResult;
import com.flamingo.ai.linkextractor.service.fetch.PdfFetcher;
import com.flamingo.ai.linkextractor.service.storage.LinkStats;
import com.flamingo.ai.linkextractor.service.storage.LinkStore;
import io.micrometer.core.annotation.Timed;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.Timer;
import java.io.IOException;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.locks.ReentrantLock;
import java.util.function.Supplier;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

/**
 * Drives links through extract, fetch, summarize and tag.
 *
 * <p>Each stage picks up where earlier runs left off: links are selected by their persisted state,
 * so a run that stops halfway is simply continued by the next one. Failures of a single file or
 * link are logged and leave that item for a later run.
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class LinkPipelineService {

  static final String METADATA_MODEL = "metadata";

  private final LinkExtractorConfig config;
  private final SourceScanner sourceScanner;
  private final LinkParser linkParser;
  private final ContentHasher contentHasher;
  private final DocumentFetcher documentFetcher;
  private final PdfFetcher pdfFetcher;
  private final Summarizer summarizer;
  private final Tagger tagger;
  private final LinkStore linkStore;
  private final MeterRegistry meterRegistry;

  private final ReentrantLock runLock = new ReentrantLock();

  /**
   * Runs the pipeline once.
   *
   * @param options stage switches and date bounds
   * @return run totals and store counters
   * @throws PipelineBusyException if another run is in progress
   * @throws PipelineConfigurationException if no notes path is configured
   * @throws IllegalArgumentException if a date bound is malformed
   */
  @Timed(value = "pipeline.run", description = "Time for a full pipeline run")
  public PipelineRunResult run(PipelineOptions options) {
    if (!runLock.tryLock()) {
      throw new PipelineBusyException();
    }
    try {
      return doRun(options);
    } finally {
      runLock.unlock();
    }
  }

  public boolean isRunning() {
    return runLock.isLocked();
  }

  private PipelineRunResult doRun(PipelineOptions options) {
    String notesPath = config.getSource().getNotesPath();
    if (notesPath == null || notesPath.isBlank()) {
      throw new PipelineConfigurationException(
          "Notes path is not configured. Set DAILY_NOTES_PATH environment variable.");
    }
    boolean skipExisting =
        options.skipExisting() != null
            ? options.skipExisting()
            : config.getPipeline().isSkipExisting();

    log.info("Scanning {} for note files...", notesPath);
    List<SourceFile> files =
        sourceScanner.scan(Path.of(notesPath), options.dateFrom(), options.dateTo());
    ExtractionTotals extraction = extractLinks(files, skipExisting);
    log.info(
        "Parsed {} of {} files, found {} links, {} new",
        extraction.filesParsed(),
        files.size(),
        extraction.linksFound(),
        extraction.newLinks());

    int fetched = options.fetch() ? timeStage("fetch", this::fetchLinks) : 0;
    int summarized = options.summarize() ? timeStage("summarize", this::summarizeLinks) : 0;
    TagTotals tagging = options.tag() ? timeStage("tag", this::tagLinks) : new TagTotals(0, 0);

    LinkStats stats = linkStore.stats();
    log.info(
        "Store stats: {} total, {} fetched, {} summarized, {} tagged",
        stats.totalLinks(),
        stats.fetched(),
        stats.summarized(),
        stats.tagged());

    return new PipelineRunResult(
        files.size(),
        extraction.filesParsed(),
        extraction.linksFound(),
        extraction.newLinks(),
        fetched,
        summarized,
        tagging.tagged(),
        tagging.tagsApplied(),
        stats);
  }

  private ExtractionTotals extractLinks(List<SourceFile> files, boolean skipExisting) {
    int filesParsed = 0;
    int linksFound = 0;
    int newLinks = 0;

    for (SourceFile file : files) {
      String path = file.path().toString();
      try {
        String hash = contentHasher.hash(file.path());
        if (skipExisting && !linkStore.fileNeedsProcessing(path, hash)) {
          continue;
        }

        List<ExtractedLink> links = linkParser.parseFile(file);
        filesParsed++;
        linksFound += links.size();

        boolean complete = true;
        for (ExtractedLink link : links) {
          try {
            if (!linkStore.linkExists(link.url())) {
              linkStore.insertLink(link);
              newLinks++;
            }
          } catch (RuntimeException e) {
            complete = false;
            log.error("Failed to store link {} from {}: {}", link.url(), path, e.getMessage());
          }
        }

        if (complete) {
          linkStore.markFileProcessed(path, hash);
        }
      } catch (IOException | RuntimeException e) {
        log.error("Failed to process {}: {}", path, e.getMessage());
      }
    }

    meterRegistry.counter("pipeline.links.new").increment(newLinks);
    return new ExtractionTotals(filesParsed, linksFound, newLinks);
  }

  private <T> T timeStage(String stage, Supplier<T> work) {
    Timer.Sample sample = Timer.start(meterRegistry);
    try {
      return work.get();
    } finally {
      sample.stop(meterRegistry.timer("pipeline.stage.duration", "stage", stage));
    }
  }

  int fetchLinks() {
    List<LinkRecord> links = linkStore.findUnfetched(config.getPipeline().getBatchSize());
    if (links.isEmpty()) {
      log.info("No unfetched links");
      return 0;
    }
    log.info("Fetching {} links...", links.size());

    int recorded = 0;
    for (LinkRecord link : links) {
      try {
        FetchResult result =
            documentFetcher.isPdf(link.getUrl())
                ? pdfFetcher.fetch(link.getUrl())
                : documentFetcher.fetch(link.getUrl());
        linkStore.updateFetchResult(
            link.getId(), result.status(), result.content(), result.title(), result.error());
        recorded++;
        meterRegistry.counter("link.fetch", "status", result.status().getValue()).increment();
        log.info("  [{}] {}", result.status().getValue(), link.getUrl());
      } catch (RuntimeException e) {
        log.error("Failed to record fetch of {}: {}", link.getUrl(), e.getMessage());
      }
    }
    return recorded;
  }

  int summarizeLinks() {
    List<LinkRecord> links = linkStore.findUnsummarized(config.getPipeline().getBatchSize());
    if (links.isEmpty()) {
      log.info("No links to summarize");
      return 0;
    }
    log.info("Summarizing {} links...", links.size());

    int summarized = 0;
    for (LinkRecord link : links) {
      try {
        if (link.getPageContent() == null || link.getPageContent().isBlank()) {
          linkStore.updateSummary(link.getId(), metadataSummary(link), METADATA_MODEL);
          summarized++;
          log.info("  [metadata] {}", link.getUrl());
          continue;
        }

        String summary =
            summarizer.summarize(
                link.getPageContent(),
                link.getPageTitle() != null ? link.getPageTitle() : link.getTitle(),
                link.getDescription(),
                link.getUrl());
        linkStore.updateSummary(link.getId(), summary, summarizer.modelName());
        summarized++;
        log.info("  Summarized: {}", link.getUrl());
      } catch (RuntimeException e) {
        log.error("Failed to summarize {}: {}", link.getUrl(), e.getMessage());
      }
    }
    meterRegistry.counter("link.summarized").increment(summarized);
    return summarized;
  }

  /**
   * Summary built from what is known without page content: page title, then the description when
   * it differs, then the link text when not already present, joined by {@code " - "}. A link
   * without any of them is summarized by its URL.
   */
  static String metadataSummary(LinkRecord link) {
    List<String> parts = new ArrayList<>();
    if (hasText(link.getPageTitle())) {
      parts.add(link.getPageTitle());
    }
    if (hasText(link.getDescription()) && !link.getDescription().equals(link.getPageTitle())) {
      parts.add(link.getDescription());
    }
    if (hasText(link.getTitle()) && !parts.contains(link.getTitle())) {
      parts.add(link.getTitle());
    }
    return parts.isEmpty() ? link.getUrl() : String.join(" - ", parts);
  }

  TagTotals tagLinks() {
    List<LinkRecord> links = linkStore.findUntagged(config.getPipeline().getBatchSize());
    if (links.isEmpty()) {
      log.info("No untagged links");
      return new TagTotals(0, 0);
    }
    log.info("Tagging {} links...", links.size());

    TagTotals totals = applyTags(links);
    log.info("Applied {} tags", totals.tagsApplied());
    return totals;
  }

  /**
   * Tags each link with the tagger's suggestions. Shared with re-tagging. A link is marked tagged
   * once the tagger answered, even with no suggestion; a failed model call leaves it for the next
   * run.
   *
   * @return links that received at least one tag and associations written
   */
  public TagTotals applyTags(List<LinkRecord> links) {
    int tagged = 0;
    int applied = 0;
    for (int i = 0; i < links.size(); i++) {
      LinkRecord link = links.get(i);
      try {
        List<TagSuggestion> suggestions = tagger.tag(link);
        int before = applied;
        for (TagSuggestion suggestion : suggestions) {
          linkStore.addTag(
              link.getId(),
              suggestion.name(),
              suggestion.category(),
              suggestion.confidence(),
              TagSource.LLM);
          applied++;
        }
        linkStore.markTagged(link.getId());
        if (applied > before) {
          tagged++;
        }
        log.info(
            "  [{}/{}] {} -> {}",
            i + 1,
            links.size(),
            link.getUrl(),
            suggestions.isEmpty()
                ? "no tags"
                : suggestions.stream().map(TagSuggestion::name).toList());
      } catch (RuntimeException e) {
        log.error("Failed to tag {}: {}", link.getUrl(), e.getMessage());
      }
    }
    meterRegistry.counter("link.tags.applied").increment(applied);
    return new TagTotals(tagged, applied);
  }

  private static boolean hasText(String value) {
    return value != null && !value.isBlank();
  }

  private record ExtractionTotals(int filesParsed, int linksFound, int newLinks) {}

  /** Counts of a tagging pass. */
  public record TagTotals(int tagged, int tagsApplied) {}
}
