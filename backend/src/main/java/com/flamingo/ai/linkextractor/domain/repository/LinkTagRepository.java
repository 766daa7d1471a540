package com.flamingo.ai.linkextractor.domain.repository;

import com.flamingo.ai.linkextractor.domain.entity.LinkRecord;
import com.flamingo.ai.linkextractor.domain.entity.LinkTag;
import java.util.List;
import java.util.Optional;
import java.util.UUID;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Modifying;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;
import org.springframework.stereotype.Repository;

/** Repository for link-tag associations. */
@Repository
public interface LinkTagRepository extends JpaRepository<LinkTag, UUID> {

  Optional<LinkTag> findByLinkIdAndTagId(UUID linkId, UUID tagId);

  List<LinkTag> findByLinkIdOrderByConfidenceDesc(UUID linkId);

  @Modifying
  @Query("DELETE FROM LinkTag lt")
  int deleteAllAssociations();

  /** Number of distinct links carrying at least one tag. */
  @Query("SELECT COUNT(DISTINCT lt.link.id) FROM LinkTag lt")
  long countTaggedLinks();

  /** Links carrying the named tag, newest source date first. */
  @Query(
      "SELECT lt.link FROM LinkTag lt WHERE lt.tag.name = :tagName "
          + "ORDER BY lt.link.sourceDate DESC")
  List<LinkRecord> findLinksByTagName(@Param("tagName") String tagName);
}
