package com.flamingo.ai.linkextractor.api.dto.response;

import com.flamingo.ai.linkextractor.service.pipeline.PipelineRunResult;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/** Response DTO for a finished pipeline run. */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class PipelineRunResponse {

  private int filesFound;
  private int filesParsed;
  private int linksFound;
  private int newLinks;
  private int fetched;
  private int summarized;
  private int tagged;
  private int tagsApplied;
  private StatsResponse stats;

  public static PipelineRunResponse fromResult(PipelineRunResult result) {
    return PipelineRunResponse.builder()
        .filesFound(result.filesFound())
        .filesParsed(result.filesParsed())
        .linksFound(result.linksFound())
        .newLinks(result.newLinks())
        .fetched(result.fetched())
        .summarized(result.summarized())
        .tagged(result.tagged())
        .tagsApplied(result.tagsApplied())
        .stats(StatsResponse.from(result.stats()))
        .build();
  }
}
