package com.flamingo.ai.linkextractor.api.dto.response;

import com.flamingo.ai.linkextractor.service.storage.LinkStats;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/** DTO for store-wide link counters. */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class StatsResponse {
  private long totalLinks;
  private long fetched;
  private long summarized;
  private long tagged;

  public static StatsResponse from(LinkStats stats) {
    return StatsResponse.builder()
        .totalLinks(stats.totalLinks())
        .fetched(stats.fetched())
        .summarized(stats.summarized())
        .tagged(stats.tagged())
        .build();
  }
}
