package com.flamingo.ai.linkextractor.api.dto.response;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.flamingo.ai.linkextractor.domain.entity.LinkRecord;
import com.flamingo.ai.linkextractor.service.search.LinkDetails;
import java.time.LocalDate;
import java.time.LocalDateTime;
import java.util.List;
import java.util.UUID;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * Response DTO for link data.
 *
 * <p>List endpoints leave out page content and tags; the detail endpoint fills them in.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
@JsonInclude(JsonInclude.Include.NON_NULL)
public class LinkResponse {

  private UUID id;
  private String url;
  private String displayTitle;
  private String title;
  private String description;
  private String domain;
  private LocalDate sourceDate;
  private String sourceFile;
  private String parentUrl;
  private int indentLevel;
  private String pageTitle;
  private String pageContent;
  private String fetchStatus;
  private String fetchError;
  private LocalDateTime fetchedAt;
  private String summary;
  private String summarizerModel;
  private LocalDateTime summarizedAt;
  private List<LinkTagResponse> tags;

  /** Creates a LinkResponse without page content and tags. */
  public static LinkResponse fromEntity(LinkRecord link) {
    return LinkResponse.builder()
        .id(link.getId())
        .url(link.getUrl())
        .displayTitle(link.displayTitle())
        .title(link.getTitle())
        .description(link.getDescription())
        .domain(link.getDomain())
        .sourceDate(link.getSourceDate())
        .sourceFile(link.getSourceFile())
        .parentUrl(link.getParentUrl())
        .indentLevel(link.getIndentLevel())
        .pageTitle(link.getPageTitle())
        .fetchStatus(link.getFetchStatus().getValue())
        .fetchError(link.getFetchError())
        .fetchedAt(link.getFetchedAt())
        .summary(link.getSummary())
        .summarizerModel(link.getSummarizerModel())
        .summarizedAt(link.getSummarizedAt())
        .build();
  }

  /** Creates a full LinkResponse including page content and tags. */
  public static LinkResponse fromDetails(LinkDetails details) {
    LinkResponse response = fromEntity(details.link());
    response.setPageContent(details.link().getPageContent());
    response.setTags(details.tags().stream().map(LinkTagResponse::fromEntity).toList());
    return response;
  }
}
