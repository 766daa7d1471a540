package com.flamingo.ai.linkextractor.service.search;

import com.flamingo.ai.linkextractor.domain.entity.LinkRecord;
import com.flamingo.ai.linkextractor.elasticsearch.LinkDocument;
import com.flamingo.ai.linkextractor.elasticsearch.LinkIndexService;
import com.flamingo.ai.linkextractor.exception.LinkNotFoundException;
import com.flamingo.ai.linkextractor.service.storage.LinkStats;
import com.flamingo.ai.linkextractor.service.storage.LinkStore;
import com.flamingo.ai.linkextractor.service.storage.TagCount;
import io.micrometer.core.annotation.Timed;
import java.util.List;
import java.util.UUID;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

/** Read side of the link store: full-text search, tag browsing and counters. */
@Service
@RequiredArgsConstructor
@Slf4j
public class LinkSearchService {

  static final int DEFAULT_LIMIT = 20;
  static final int MAX_LIMIT = 100;

  private final LinkIndexService linkIndexService;
  private final LinkStore linkStore;

  /**
   * Full-text search over link text, page text and summaries.
   *
   * @param query the search terms
   * @param limit maximum number of hits; {@code null} or non-positive for the default
   * @return matching links, best match first
   * @throws IllegalArgumentException if the query is blank
   */
  @Timed(value = "link.search", description = "Time to search links")
  public List<LinkRecord> search(String query, Integer limit) {
    if (query == null || query.isBlank()) {
      throw new IllegalArgumentException("Search query must not be blank");
    }
    int size = limit == null || limit <= 0 ? DEFAULT_LIMIT : Math.min(limit, MAX_LIMIT);

    List<UUID> ids =
        linkIndexService.keywordSearch(query.strip(), size).stream()
            .map(LinkDocument::getId)
            .map(UUID::fromString)
            .toList();
    List<LinkRecord> links = linkStore.findAllByIds(ids);
    log.debug("Search '{}' matched {} links", query, links.size());
    return links;
  }

  public LinkDetails getLink(UUID linkId) {
    LinkRecord link =
        linkStore.findById(linkId).orElseThrow(() -> new LinkNotFoundException(linkId));
    return new LinkDetails(link, linkStore.tagsFor(linkId));
  }

  public List<LinkRecord> linksByTag(String tagName) {
    return linkStore.linksByTag(tagName);
  }

  public List<TagCount> tagCounts() {
    return linkStore.tagCounts();
  }

  public LinkStats stats() {
    return linkStore.stats();
  }
}
