package com.flamingo.ai.linkextractor.api.dto.response;

import com.flamingo.ai.linkextractor.service.storage.TagCount;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/** Response DTO for a catalogue tag and its usage. */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class TagCountResponse {
  private String name;
  private String category;
  private long count;

  public static TagCountResponse from(TagCount tagCount) {
    return TagCountResponse.builder()
        .name(tagCount.name())
        .category(tagCount.category().getValue())
        .count(tagCount.count())
        .build();
  }
}
