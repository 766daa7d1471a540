package com.flamingo.ai.linkextractor.service.extraction;

import java.time.LocalDate;

/**
 * A link as it appears in one note, before anything is known about the page behind it.
 *
 * @param url absolute http(s) URL
 * @param title link text of an inline link, {@code null} for bare URLs
 * @param description the surrounding words of the list item, {@code null} when there are none
 * @param sourceDate date of the note the link was found in
 * @param sourceFile path of that note
 * @param indentLevel nesting depth of the list item, 0 for top-level items
 * @param parentUrl URL of the nearest enclosing list item, {@code null} at top level
 */
public record ExtractedLink(
    String url,
    String title,
    String description,
    LocalDate sourceDate,
    String sourceFile,
    int indentLevel,
    String parentUrl) {}
