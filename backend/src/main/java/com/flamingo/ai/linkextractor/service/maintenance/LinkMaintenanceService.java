package com.flamingo.ai.linkextractor.service.maintenance;

import com.flamingo.ai.linkextractor.config.LinkExtractorConfig;
import com.flamingo.ai.linkextractor.domain.entity.LinkRecord;
import com.flamingo.ai.linkextractor.service.pipeline.LinkPipelineService;
import com.flamingo.ai.linkextractor.service.pipeline.LinkPipelineService.TagTotals;
import com.flamingo.ai.linkextractor.service.storage.LinkStore;
import java.util.List;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

/** Manual repair operations on stored links. */
@Service
@RequiredArgsConstructor
@Slf4j
public class LinkMaintenanceService {

  private final LinkStore linkStore;
  private final LinkPipelineService pipelineService;
  private final LinkExtractorConfig config;

  /**
   * Sends successful fetches that yielded missing or very short content back to the fetch stage.
   * The next pipeline run fetches them again.
   *
   * @param limit maximum number of links; {@code null} for the configured default
   * @param dryRun only list the candidates
   */
  public RefetchResult refetch(Integer limit, boolean dryRun) {
    int max = limit != null && limit > 0 ? limit : config.getRefetch().getDefaultLimit();
    List<LinkRecord> candidates =
        linkStore.findEmptyContent(max, config.getRefetch().getMinContentLength());
    log.info("Found {} links with empty content", candidates.size());

    if (dryRun || candidates.isEmpty()) {
      return new RefetchResult(candidates, 0, dryRun);
    }

    int reset = 0;
    for (LinkRecord link : candidates) {
      try {
        linkStore.resetFetchStatus(link.getId());
        reset++;
      } catch (RuntimeException e) {
        log.error("Failed to reset {}: {}", link.getUrl(), e.getMessage());
      }
    }
    log.info("Reset {} links for refetch", reset);
    return new RefetchResult(candidates, reset, false);
  }

  /**
   * Tags every link past the fetch stage again, optionally dropping all existing associations
   * first.
   *
   * @param clearExisting remove all link-tag associations before tagging
   * @param limit maximum number of links; {@code null} for all
   */
  public RetagResult retag(boolean clearExisting, Integer limit) {
    int cleared = 0;
    if (clearExisting) {
      log.info("Clearing existing tags...");
      cleared = linkStore.clearAllTags();
    }

    List<LinkRecord> links =
        linkStore.findProcessed(limit != null && limit > 0 ? limit : Integer.MAX_VALUE);
    log.info("Re-tagging {} links...", links.size());

    TagTotals totals = pipelineService.applyTags(links);
    log.info("Applied {} tags to {} links", totals.tagsApplied(), links.size());

    return new RetagResult(
        cleared, links.size(), totals.tagged(), totals.tagsApplied(), linkStore.tagCounts());
  }
}
