package com.flamingo.ai.linkextractor.domain.entity;

import com.flamingo.ai.linkextractor.domain.enums.TagSource;
import jakarta.persistence.Column;
import jakarta.persistence.Entity;
import jakarta.persistence.EnumType;
import jakarta.persistence.Enumerated;
import jakarta.persistence.FetchType;
import jakarta.persistence.GeneratedValue;
import jakarta.persistence.GenerationType;
import jakarta.persistence.Id;
import jakarta.persistence.JoinColumn;
import jakarta.persistence.ManyToOne;
import jakarta.persistence.Table;
import jakarta.persistence.UniqueConstraint;
import java.util.UUID;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Getter;
import lombok.NoArgsConstructor;
import lombok.Setter;

/** Association of a tag with a link, with the confidence of the assignment. */
@Entity
@Table(
    name = "link_tags",
    uniqueConstraints = @UniqueConstraint(columnNames = {"link_id", "tag_id"}))
@Getter
@Setter
@NoArgsConstructor
@AllArgsConstructor
@Builder
public class LinkTag {

  @Id
  @GeneratedValue(strategy = GenerationType.UUID)
  private UUID id;

  @ManyToOne(fetch = FetchType.LAZY)
  @JoinColumn(name = "link_id", nullable = false)
  private LinkRecord link;

  @ManyToOne(fetch = FetchType.EAGER)
  @JoinColumn(name = "tag_id", nullable = false)
  private Tag tag;

  /** Confidence in [0, 1]. */
  @Column(nullable = false)
  @Builder.Default
  private double confidence = 1.0;

  @Enumerated(EnumType.STRING)
  @Column(nullable = false)
  @Builder.Default
  private TagSource source = TagSource.AUTO;
}
