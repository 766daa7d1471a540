package com.flamingo.ai.linkextractor.service.maintenance;

import com.flamingo.ai.linkextractor.service.storage.TagCount;
import java.util.List;

/**
 * Outcome of re-tagging.
 *
 * @param clearedAssociations associations removed before tagging
 * @param linksProcessed links sent to the tagger
 * @param linksTagged links that received at least one tag
 * @param tagsApplied associations written
 * @param distribution tag counts after the run, most used first
 */
public record RetagResult(
    int clearedAssociations,
    int linksProcessed,
    int linksTagged,
    int tagsApplied,
    List<TagCount> distribution) {}
