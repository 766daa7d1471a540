package com.flamingo.ai.linkextractor.api.dto.response;

import com.flamingo.ai.linkextractor.domain.entity.LinkTag;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/** Response DTO for a tag attached to a link. */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class LinkTagResponse {
  private String name;
  private String category;
  private double confidence;
  private String source;

  public static LinkTagResponse fromEntity(LinkTag linkTag) {
    return LinkTagResponse.builder()
        .name(linkTag.getTag().getName())
        .category(linkTag.getTag().getCategory().getValue())
        .confidence(linkTag.getConfidence())
        .source(linkTag.getSource().getValue())
        .build();
  }
}
