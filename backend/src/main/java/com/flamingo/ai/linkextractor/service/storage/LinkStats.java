package com.flamingo.ai.linkextractor.service.storage;

/**
 * Store-wide counters.
 *
 * @param totalLinks every stored link
 * @param fetched links whose last fetch succeeded
 * @param summarized links carrying a summary
 * @param tagged links carrying at least one tag
 */
public record LinkStats(long totalLinks, long fetched, long summarized, long tagged) {}
