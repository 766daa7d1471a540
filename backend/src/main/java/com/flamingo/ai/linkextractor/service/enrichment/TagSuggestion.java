package com.flamingo.ai.linkextractor.service.enrichment;

import com.flamingo.ai.linkextractor.domain.enums.TagCategory;

/**
 * A tag proposed for a link.
 *
 * @param name vocabulary name of the tag
 * @param category the category the name belongs to
 * @param confidence confidence in [0, 1]
 */
public record TagSuggestion(String name, TagCategory category, double confidence) {}
