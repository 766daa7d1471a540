package com.flamingo.ai.linkextractor.api.dto.response;

import com.flamingo.ai.linkextractor.domain.entity.LinkRecord;
import com.flamingo.ai.linkextractor.service.maintenance.RefetchResult;
import java.util.List;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/** Response DTO for a refetch request. */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class RefetchResponse {
  private boolean dryRun;
  private int candidateCount;
  private int reset;
  private List<String> urls;

  public static RefetchResponse fromResult(RefetchResult result) {
    return RefetchResponse.builder()
        .dryRun(result.dryRun())
        .candidateCount(result.candidates().size())
        .reset(result.reset())
        .urls(result.candidates().stream().map(LinkRecord::getUrl).toList())
        .build();
  }
}
