package com.flamingo.ai.linkextractor.api.dto.response;

import com.flamingo.ai.linkextractor.service.maintenance.RetagResult;
import java.util.List;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/** Response DTO for a re-tagging request. */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class RetagResponse {
  private int clearedAssociations;
  private int linksProcessed;
  private int linksTagged;
  private int tagsApplied;
  private List<TagCountResponse> distribution;

  public static RetagResponse fromResult(RetagResult result) {
    return RetagResponse.builder()
        .clearedAssociations(result.clearedAssociations())
        .linksProcessed(result.linksProcessed())
        .linksTagged(result.linksTagged())
        .tagsApplied(result.tagsApplied())
        .distribution(result.distribution().stream().map(TagCountResponse::from).toList())
        .build();
  }
}
