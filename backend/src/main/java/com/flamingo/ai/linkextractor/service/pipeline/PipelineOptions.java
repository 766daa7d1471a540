package com.flamingo.ai.linkextractor.service.pipeline;

/**
 * Switches for one pipeline run.
 *
 * @param fetch run the fetch stage
 * @param summarize run the summarize stage
 * @param tag run the tag stage
 * @param skipExisting skip note files whose content hash is unchanged; {@code null} for the
 *     configured default
 * @param dateFrom inclusive lower bound on note dates (ISO), or {@code null}
 * @param dateTo inclusive upper bound on note dates (ISO), or {@code null}
 */
public record PipelineOptions(
    boolean fetch,
    boolean summarize,
    boolean tag,
    Boolean skipExisting,
    String dateFrom,
    String dateTo) {

  /** Every stage, configured skip behaviour, no date bounds. */
  public static PipelineOptions defaults() {
    return new PipelineOptions(true, true, true, null, null, null);
  }
}
