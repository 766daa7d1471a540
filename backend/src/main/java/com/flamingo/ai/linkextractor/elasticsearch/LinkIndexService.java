package com.flamingo.ai.linkextractor.elasticsearch;

import co.elastic.clients.elasticsearch.ElasticsearchClient;
import co.elastic.clients.elasticsearch._types.mapping.Property;
import co.elastic.clients.elasticsearch._types.mapping.TextProperty;
import co.elastic.clients.elasticsearch._types.query_dsl.TextQueryType;
import co.elastic.clients.elasticsearch.core.IndexRequest;
import co.elastic.clients.elasticsearch.core.SearchRequest;
import co.elastic.clients.elasticsearch.core.SearchResponse;
import co.elastic.clients.elasticsearch.core.search.Hit;
import co.elastic.clients.elasticsearch.indices.CreateIndexRequest;
import com.flamingo.ai.linkextractor.domain.entity.LinkRecord;
import com.flamingo.ai.linkextractor.exception.SearchException;
import io.github.resilience4j.circuitbreaker.annotation.CircuitBreaker;
import io.micrometer.core.annotation.Timed;
import io.micrometer.core.instrument.MeterRegistry;
import jakarta.annotation.PostConstruct;
import java.io.IOException;
import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Service;

/**
 * Elasticsearch index service for links.
 *
 * <p>Keeps one document per link with its note text, page text and summary, and answers keyword
 * queries over them. Writes are synchronous so callers can roll back their own changes when the
 * index rejects an update.
 */
@Service
@Slf4j
public class LinkIndexService {

  static final String[] SEARCH_FIELDS = {
    "title^2", "pageTitle^2", "summary^1.5", "description", "pageContent"
  };

  private final ElasticsearchClient elasticsearchClient;
  private final MeterRegistry meterRegistry;

  @Value("${app.elasticsearch.link-index-name:link-extractor-links}")
  private String indexName;

  public LinkIndexService(ElasticsearchClient elasticsearchClient, MeterRegistry meterRegistry) {
    this.elasticsearchClient = elasticsearchClient;
    this.meterRegistry = meterRegistry;
  }

  @PostConstruct
  public void initIndex() {
    try {
      var indices = elasticsearchClient.indices();
      if (indices == null) {
        log.warn("Elasticsearch client not available, skipping link index initialization");
        return;
      }
      boolean exists = indices.exists(e -> e.index(indexName)).value();
      if (!exists) {
        createIndex();
        log.info("Created Elasticsearch link index: {}", indexName);
      }
    } catch (Exception e) {
      log.warn("Could not check/create Elasticsearch link index: {}", e.getMessage());
    }
  }

  private void createIndex() throws IOException {
    Map<String, Property> properties = new HashMap<>();
    properties.put("url", Property.of(p -> p.keyword(k -> k)));
    properties.put("domain", Property.of(p -> p.keyword(k -> k)));
    properties.put("fetchStatus", Property.of(p -> p.keyword(k -> k)));
    properties.put("sourceDate", Property.of(p -> p.date(d -> d)));
    properties.put("title", Property.of(p -> p.text(TextProperty.of(t -> t))));
    properties.put("description", Property.of(p -> p.text(TextProperty.of(t -> t))));
    properties.put("pageTitle", Property.of(p -> p.text(TextProperty.of(t -> t))));
    properties.put("pageContent", Property.of(p -> p.text(TextProperty.of(t -> t))));
    properties.put("summary", Property.of(p -> p.text(TextProperty.of(t -> t))));

    CreateIndexRequest createIndexRequest =
        CreateIndexRequest.of(c -> c.index(indexName).mappings(m -> m.properties(properties)));

    elasticsearchClient.indices().create(createIndexRequest);
  }

  /**
   * Writes the current state of a link to the index, replacing any previous document.
   *
   * @param link the persisted link; must have an id
   * @throws SearchException if the index write fails
   */
  @Timed(value = "link.index", description = "Time to index a link")
  public void index(LinkRecord link) {
    LinkDocument document = LinkDocument.fromRecord(link);
    try {
      Map<String, Object> source = convertToElasticsearchDoc(document);
      IndexRequest<Map<String, Object>> request =
          IndexRequest.of(i -> i.index(indexName).id(document.getId()).document(source));
      elasticsearchClient.index(request);
      meterRegistry.counter("link.indexed").increment();
      log.debug("Indexed link {}", document.getId());
    } catch (IOException e) {
      log.error("Failed to index link {}: {}", document.getId(), e.getMessage(), e);
      throw new SearchException("Failed to index link " + document.getId(), e);
    }
  }

  /**
   * Performs keyword search over link text.
   *
   * @param query the search query
   * @param topK number of results to return
   * @return matching documents, best first; empty when the index is unavailable
   */
  @Timed(value = "link.keyword_search", description = "Time to keyword search links")
  @CircuitBreaker(name = "elasticsearch", fallbackMethod = "keywordSearchFallback")
  public List<LinkDocument> keywordSearch(String query, int topK) {
    try {
      SearchRequest searchRequest =
          SearchRequest.of(
              s ->
                  s.index(indexName)
                      .size(topK)
                      .query(
                          q ->
                              q.multiMatch(
                                  mm ->
                                      mm.query(query)
                                          .fields(List.of(SEARCH_FIELDS))
                                          .type(TextQueryType.BestFields))));

      SearchResponse<Map> response = elasticsearchClient.search(searchRequest, Map.class);
      List<LinkDocument> results = new ArrayList<>();
      for (Hit<Map> hit : response.hits().hits()) {
        if (hit.source() == null) {
          continue;
        }
        LinkDocument doc = convertFromElasticsearchDoc(hit.id(), hit.source());
        doc.setRelevanceScore(hit.score() != null ? hit.score() : 0.0);
        results.add(doc);
      }

      meterRegistry.counter("link.keyword_search").increment();
      log.debug("Keyword search '{}' returned {} links", query, results.size());
      return results;
    } catch (IOException e) {
      log.error("Keyword search failed for links: {}", e.getMessage(), e);
      throw new SearchException("Keyword search failed", e);
    }
  }

  @SuppressWarnings("unused")
  private List<LinkDocument> keywordSearchFallback(String query, int topK, Throwable t) {
    log.warn("Link keyword search fallback triggered: {}", t.getMessage());
    meterRegistry.counter("link.keyword_search.fallback").increment();
    return List.of();
  }

  private Map<String, Object> convertToElasticsearchDoc(LinkDocument link) {
    Map<String, Object> doc = new HashMap<>();
    doc.put("url", link.getUrl());
    doc.put("domain", link.getDomain());
    doc.put("fetchStatus", link.getFetchStatus());
    doc.put("sourceDate", link.getSourceDate());
    doc.put("title", link.getTitle());
    doc.put("description", link.getDescription());
    doc.put("pageTitle", link.getPageTitle());
    doc.put("pageContent", link.getPageContent());
    doc.put("summary", link.getSummary());
    return doc;
  }

  private LinkDocument convertFromElasticsearchDoc(String id, Map<String, Object> source) {
    return LinkDocument.builder()
        .id(id)
        .url((String) source.get("url"))
        .domain((String) source.get("domain"))
        .fetchStatus((String) source.get("fetchStatus"))
        .sourceDate((String) source.get("sourceDate"))
        .title((String) source.get("title"))
        .description((String) source.get("description"))
        .pageTitle((String) source.get("pageTitle"))
        .pageContent((String) source.get("pageContent"))
        .summary((String) source.get("summary"))
        .build();
  }
}
