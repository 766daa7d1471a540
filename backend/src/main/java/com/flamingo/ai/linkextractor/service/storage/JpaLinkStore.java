package com.flamingo.ai.linkextractor.service.storage;

import com.flamingo.ai.linkextractor.domain.entity.LinkRecord;
import com.flamingo.ai.linkextractor.domain.entity.LinkTag;
import com.flamingo.ai.linkextractor.domain.entity.ProcessingLogEntry;
import com.flamingo.ai.linkextractor.domain.entity.Tag;
import com.flamingo.ai.linkextractor.domain.enums.FetchStatus;
import com.flamingo.ai.linkextractor.domain.enums.TagCategory;
import com.flamingo.ai.linkextractor.domain.enums.TagSource;
import com.flamingo.ai.linkextractor.domain.repository.LinkRecordRepository;
import com.flamingo.ai.linkextractor.domain.repository.LinkTagRepository;
import com.flamingo.ai.linkextractor.domain.repository.ProcessingLogRepository;
import com.flamingo.ai.linkextractor.domain.repository.TagRepository;
import com.flamingo.ai.linkextractor.elasticsearch.LinkIndexService;
import com.flamingo.ai.linkextractor.exception.LinkNotFoundException;
import com.flamingo.ai.linkextractor.service.extraction.ExtractedLink;
import com.flamingo.ai.linkextractor.service.fetch.LinkUrls;
import java.time.LocalDateTime;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.UUID;
import java.util.function.Function;
import java.util.stream.Collectors;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.data.domain.PageRequest;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

/**
 * {@link LinkStore} backed by JPA, mirroring link text into the Elasticsearch index.
 *
 * <p>Index writes happen inside the same transaction as the row change, so a rejected index write
 * rolls the row change back.
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class JpaLinkStore implements LinkStore {

  private final LinkRecordRepository linkRepository;
  private final TagRepository tagRepository;
  private final LinkTagRepository linkTagRepository;
  private final ProcessingLogRepository processingLogRepository;
  private final LinkIndexService linkIndexService;

  @Override
  @Transactional(readOnly = true)
  public boolean linkExists(String url) {
    return linkRepository.existsByUrl(url);
  }

  @Override
  @Transactional
  public UUID insertLink(ExtractedLink link) {
    Optional<LinkRecord> existing = linkRepository.findByUrl(link.url());
    if (existing.isPresent()) {
      return existing.get().getId();
    }

    LinkRecord record =
        LinkRecord.builder()
            .url(link.url())
            .title(link.title())
            .description(link.description())
            .domain(LinkUrls.host(link.url()))
            .sourceDate(link.sourceDate())
            .sourceFile(link.sourceFile())
            .parentUrl(link.parentUrl())
            .indentLevel(link.indentLevel())
            .fetchStatus(FetchStatus.NOT_FETCHED)
            .build();
    LinkRecord saved = linkRepository.save(record);
    linkIndexService.index(saved);
    log.debug("Inserted link {} ({})", saved.getId(), saved.getUrl());
    return saved.getId();
  }

  @Override
  @Transactional
  public void updateFetchResult(
      UUID linkId, FetchStatus status, String content, String pageTitle, String error) {
    LinkRecord record = getLink(linkId);
    record.markFetched(status, content, pageTitle, error);
    linkIndexService.index(linkRepository.save(record));
  }

  @Override
  @Transactional
  public void updateSummary(UUID linkId, String summary, String modelName) {
    LinkRecord record = getLink(linkId);
    record.markSummarized(summary, modelName);
    linkIndexService.index(linkRepository.save(record));
  }

  @Override
  @Transactional
  public void addTag(
      UUID linkId, String tagName, TagCategory category, double confidence, TagSource source) {
    LinkRecord record = getLink(linkId);
    Tag tag =
        tagRepository
            .findByName(tagName)
            .orElseGet(
                () -> tagRepository.save(Tag.builder().name(tagName).category(category).build()));

    double clamped = Math.max(0.0, Math.min(1.0, confidence));
    LinkTag association =
        linkTagRepository
            .findByLinkIdAndTagId(record.getId(), tag.getId())
            .orElseGet(() -> LinkTag.builder().link(record).tag(tag).build());
    association.setConfidence(clamped);
    association.setSource(source);
    linkTagRepository.save(association);
  }

  @Override
  @Transactional(readOnly = true)
  public boolean fileNeedsProcessing(String sourceFile, String fileHash) {
    return processingLogRepository
        .findBySourceFile(sourceFile)
        .map(entry -> !entry.getFileHash().equals(fileHash))
        .orElse(true);
  }

  @Override
  @Transactional
  public void markFileProcessed(String sourceFile, String fileHash) {
    ProcessingLogEntry entry =
        processingLogRepository
            .findBySourceFile(sourceFile)
            .orElseGet(() -> ProcessingLogEntry.builder().sourceFile(sourceFile).build());
    entry.setFileHash(fileHash);
    entry.setProcessedAt(LocalDateTime.now());
    processingLogRepository.save(entry);
  }

  @Override
  @Transactional(readOnly = true)
  public List<LinkRecord> findUnfetched(int limit) {
    return linkRepository.findByFetchStatusOrderBySourceDateDesc(
        FetchStatus.NOT_FETCHED, PageRequest.of(0, limit));
  }

  @Override
  @Transactional(readOnly = true)
  public List<LinkRecord> findUnsummarized(int limit) {
    return linkRepository.findUnsummarized(FetchStatus.NOT_FETCHED, PageRequest.of(0, limit));
  }

  @Override
  @Transactional(readOnly = true)
  public List<LinkRecord> findUntagged(int limit) {
    return linkRepository.findUntagged(FetchStatus.NOT_FETCHED, PageRequest.of(0, limit));
  }

  @Override
  @Transactional(readOnly = true)
  public List<LinkRecord> findEmptyContent(int limit, int minLength) {
    return linkRepository.findEmptyContent(
        FetchStatus.SUCCESS, minLength, PageRequest.of(0, limit));
  }

  @Override
  @Transactional(readOnly = true)
  public List<LinkRecord> findProcessed(int limit) {
    return linkRepository.findProcessed(FetchStatus.NOT_FETCHED, PageRequest.of(0, limit));
  }

  @Override
  @Transactional
  public void resetFetchStatus(UUID linkId) {
    LinkRecord record = getLink(linkId);
    record.resetFetch();
    linkIndexService.index(linkRepository.save(record));
  }

  @Override
  @Transactional
  public void markTagged(UUID linkId) {
    LinkRecord record = getLink(linkId);
    record.markTagged();
    linkRepository.save(record);
  }

  @Override
  @Transactional
  public int clearAllTags() {
    int removed = linkTagRepository.deleteAllAssociations();
    int reset = linkRepository.clearTaggedAt();
    log.info("Removed {} link-tag associations, {} links back to untagged", removed, reset);
    return removed;
  }

  @Override
  @Transactional(readOnly = true)
  public Optional<LinkRecord> findById(UUID linkId) {
    return linkRepository.findById(linkId);
  }

  @Override
  @Transactional(readOnly = true)
  public List<LinkRecord> findAllByIds(List<UUID> linkIds) {
    Map<UUID, LinkRecord> byId =
        linkRepository.findAllById(linkIds).stream()
            .collect(Collectors.toMap(LinkRecord::getId, Function.identity()));
    List<LinkRecord> ordered = new ArrayList<>(linkIds.size());
    for (UUID id : linkIds) {
      LinkRecord record = byId.get(id);
      if (record != null) {
        ordered.add(record);
      }
    }
    return ordered;
  }

  @Override
  @Transactional(readOnly = true)
  public List<LinkTag> tagsFor(UUID linkId) {
    return linkTagRepository.findByLinkIdOrderByConfidenceDesc(linkId);
  }

  @Override
  @Transactional(readOnly = true)
  public List<LinkRecord> linksByTag(String tagName) {
    return linkTagRepository.findLinksByTagName(tagName);
  }

  @Override
  @Transactional(readOnly = true)
  public List<TagCount> tagCounts() {
    return tagRepository.findAllWithCounts();
  }

  @Override
  @Transactional(readOnly = true)
  public LinkStats stats() {
    return new LinkStats(
        linkRepository.count(),
        linkRepository.countByFetchStatus(FetchStatus.SUCCESS),
        linkRepository.countBySummaryIsNotNull(),
        linkTagRepository.countTaggedLinks());
  }

  private LinkRecord getLink(UUID linkId) {
    return linkRepository.findById(linkId).orElseThrow(() -> new LinkNotFoundException(linkId));
  }
}
