package com.flamingo.ai.linkextractor.service.pipeline;

import com.flamingo.ai.linkextractor.service.storage.LinkStats;

/**
 * Totals of one pipeline run.
 *
 * @param filesFound note files matched by the scan
 * @param filesParsed files actually parsed (new or changed)
 * @param linksFound links found in the parsed files, duplicates included
 * @param newLinks links inserted because their URL was not stored yet
 * @param fetched links whose fetch outcome was recorded
 * @param summarized links that received a summary, metadata summaries included
 * @param tagged links that received at least one tag
 * @param tagsApplied tag associations written
 * @param stats store-wide counters after the run
 */
public record PipelineRunResult(
    int filesFound,
    int filesParsed,
    int linksFound,
    int newLinks,
    int fetched,
    int summarized,
    int tagged,
    int tagsApplied,
    LinkStats stats) {}
