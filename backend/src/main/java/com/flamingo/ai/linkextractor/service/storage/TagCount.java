package com.flamingo.ai.linkextractor.service.storage;

import com.flamingo.ai.linkextractor.domain.enums.TagCategory;

/** A catalogue tag with the number of links carrying it. */
public record TagCount(String name, TagCategory category, long count) {}
