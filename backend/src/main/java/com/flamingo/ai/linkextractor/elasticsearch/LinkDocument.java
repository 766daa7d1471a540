package com.flamingo.ai.linkextractor.elasticsearch;

import com.flamingo.ai.linkextractor.domain.entity.LinkRecord;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * Elasticsearch document model for links.
 *
 * <p>Carries the searchable text of a {@link LinkRecord}. The row in the relational store stays the
 * source of truth; search hits are resolved back to it by id.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class LinkDocument {

  /** Unique identifier (matches LinkRecord.id) */
  private String id;

  private String url;

  private String domain;

  private String title;

  private String description;

  private String pageTitle;

  private String pageContent;

  private String summary;

  private String fetchStatus;

  /** Source note date as ISO string */
  private String sourceDate;

  /** Relevance score from search */
  @Builder.Default private double relevanceScore = 0.0;

  public static LinkDocument fromRecord(LinkRecord record) {
    return LinkDocument.builder()
        .id(record.getId().toString())
        .url(record.getUrl())
        .domain(record.getDomain())
        .title(record.getTitle())
        .description(record.getDescription())
        .pageTitle(record.getPageTitle())
        .pageContent(record.getPageContent())
        .summary(record.getSummary())
        .fetchStatus(record.getFetchStatus().getValue())
        .sourceDate(record.getSourceDate() != null ? record.getSourceDate().toString() : null)
        .build();
  }
}
