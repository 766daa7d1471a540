package com.flamingo.ai.linkextractor.domain.repository;

import com.flamingo.ai.linkextractor.domain.entity.LinkRecord;
import com.flamingo.ai.linkextractor.domain.enums.FetchStatus;
import java.util.List;
import java.util.Optional;
import java.util.UUID;
import org.springframework.data.domain.Pageable;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Modifying;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;
import org.springframework.stereotype.Repository;

/** Repository for {@link LinkRecord} entities. Batch queries return newest source date first. */
@Repository
public interface LinkRecordRepository extends JpaRepository<LinkRecord, UUID> {

  boolean existsByUrl(String url);

  Optional<LinkRecord> findByUrl(String url);

  /** Links in the given fetch state. */
  List<LinkRecord> findByFetchStatusOrderBySourceDateDesc(FetchStatus status, Pageable pageable);

  /** Links whose fetch stage has completed (any outcome) but that have no summary yet. */
  @Query(
      "SELECT l FROM LinkRecord l WHERE l.fetchStatus <> :notFetched AND l.summary IS NULL "
          + "ORDER BY l.sourceDate DESC")
  List<LinkRecord> findUnsummarized(
      @Param("notFetched") FetchStatus notFetched, Pageable pageable);

  /** Links whose fetch stage has completed, never tagged and carrying no tag association. */
  @Query(
      "SELECT l FROM LinkRecord l WHERE l.fetchStatus <> :notFetched AND l.taggedAt IS NULL "
          + "AND NOT EXISTS (SELECT lt.id FROM LinkTag lt WHERE lt.link = l) "
          + "ORDER BY l.sourceDate DESC")
  List<LinkRecord> findUntagged(@Param("notFetched") FetchStatus notFetched, Pageable pageable);

  /** Links whose fetch stage has completed, whatever the outcome. */
  @Query(
      "SELECT l FROM LinkRecord l WHERE l.fetchStatus <> :notFetched ORDER BY l.sourceDate DESC")
  List<LinkRecord> findProcessed(@Param("notFetched") FetchStatus notFetched, Pageable pageable);

  /** Successfully fetched links whose extracted content is missing or shorter than minLength. */
  @Query(
      "SELECT l FROM LinkRecord l WHERE l.fetchStatus = :success "
          + "AND (l.pageContent IS NULL OR LENGTH(l.pageContent) < :minLength) "
          + "ORDER BY l.sourceDate DESC")
  List<LinkRecord> findEmptyContent(
      @Param("success") FetchStatus success,
      @Param("minLength") int minLength,
      Pageable pageable);

  /** Returns every link to the untagged state. */
  @Modifying
  @Query("UPDATE LinkRecord l SET l.taggedAt = NULL WHERE l.taggedAt IS NOT NULL")
  int clearTaggedAt();

  long countByFetchStatus(FetchStatus status);

  long countBySummaryIsNotNull();
}
