package com.flamingo.ai.linkextractor.domain.entity;

import com.flamingo.ai.linkextractor.domain.converter.FetchStatusConverter;
import com.flamingo.ai.linkextractor.domain.enums.FetchStatus;
import jakarta.persistence.Column;
import jakarta.persistence.Convert;
import jakarta.persistence.Entity;
import jakarta.persistence.GeneratedValue;
import jakarta.persistence.GenerationType;
import jakarta.persistence.Id;
import jakarta.persistence.Index;
import jakarta.persistence.PrePersist;
import jakarta.persistence.PreUpdate;
import jakarta.persistence.Table;
import java.time.LocalDate;
import java.time.LocalDateTime;
import java.util.UUID;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Getter;
import lombok.NoArgsConstructor;
import lombok.Setter;

/** A link harvested from a daily note, together with everything later stages learned about it. */
@Entity
@Table(
    name = "links",
    indexes = {
      @Index(name = "idx_links_source_date", columnList = "sourceDate"),
      @Index(name = "idx_links_domain", columnList = "domain"),
      @Index(name = "idx_links_fetch_status", columnList = "fetchStatus")
    })
@Getter
@Setter
@NoArgsConstructor
@AllArgsConstructor
@Builder
public class LinkRecord {

  @Id
  @GeneratedValue(strategy = GenerationType.UUID)
  @Column(updatable = false)
  private UUID id;

  @Column(nullable = false, unique = true, columnDefinition = "TEXT")
  private String url;

  /** Link text of an inline {@code [title](url)} item. */
  @Column(columnDefinition = "TEXT")
  private String title;

  /** The note author's own words around the link. */
  @Column(columnDefinition = "TEXT")
  private String description;

  @Column(nullable = false)
  private String domain;

  @Column(nullable = false)
  private LocalDate sourceDate;

  @Column(nullable = false, columnDefinition = "TEXT")
  private String sourceFile;

  @Column(columnDefinition = "TEXT")
  private String parentUrl;

  @Builder.Default private int indentLevel = 0;

  @Column(columnDefinition = "TEXT")
  private String pageTitle;

  @Column(columnDefinition = "TEXT")
  private String pageContent;

  @Convert(converter = FetchStatusConverter.class)
  @Column(nullable = false)
  @Builder.Default
  private FetchStatus fetchStatus = FetchStatus.NOT_FETCHED;

  @Column(columnDefinition = "TEXT")
  private String fetchError;

  private LocalDateTime fetchedAt;

  @Column(columnDefinition = "TEXT")
  private String summary;

  private LocalDateTime summarizedAt;

  private String summarizerModel;

  /** When the tag stage last completed for this link, whether or not it produced tags. */
  private LocalDateTime taggedAt;

  @Column(nullable = false, updatable = false)
  private LocalDateTime createdAt;

  private LocalDateTime updatedAt;

  @PrePersist
  protected void onCreate() {
    createdAt = LocalDateTime.now();
    updatedAt = createdAt;
  }

  @PreUpdate
  protected void onUpdate() {
    updatedAt = LocalDateTime.now();
  }

  /** Records the outcome of the fetch stage. */
  public void markFetched(FetchStatus status, String content, String pageTitle, String error) {
    this.fetchStatus = status;
    this.pageContent = content;
    this.pageTitle = pageTitle;
    this.fetchError = error;
    this.fetchedAt = LocalDateTime.now();
  }

  /** Records the outcome of the summarize stage. */
  public void markSummarized(String summary, String modelName) {
    this.summary = summary;
    this.summarizerModel = modelName;
    this.summarizedAt = LocalDateTime.now();
  }

  /** Returns the link to the unfetched state so the next run fetches it again. */
  public void resetFetch() {
    this.fetchStatus = FetchStatus.NOT_FETCHED;
    this.pageContent = null;
    this.pageTitle = null;
    this.fetchError = null;
    this.fetchedAt = null;
  }

  /** Records that the tag stage completed, so the link leaves the untagged backlog. */
  public void markTagged() {
    this.taggedAt = LocalDateTime.now();
  }

  /** Best human-readable label: page title, then link text, then description, then URL. */
  public String displayTitle() {
    if (pageTitle != null && !pageTitle.isBlank()) {
      return pageTitle;
    }
    if (title != null && !title.isBlank()) {
      return title;
    }
    if (description != null && !description.isBlank()) {
      return description;
    }
    return url;
  }
}
