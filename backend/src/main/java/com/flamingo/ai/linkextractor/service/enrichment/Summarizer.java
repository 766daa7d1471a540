package com.flamingo.ai.linkextractor.service.enrichment;

/** Produces a short prose summary of a fetched page. */
public interface Summarizer {

  /**
   * Summarizes page content.
   *
   * @param content extracted page text
   * @param title page title or link text, may be {@code null}
   * @param description the note author's words about the link, may be {@code null}
   * @param url the link URL
   * @return the summary
   * @throws com.flamingo.ai.linkextractor.exception.LlmServiceException if no summary could be
   *     produced
   */
  String summarize(String content, String title, String description, String url);

  /** Identifier stored with each summary. */
  String modelName();
}
