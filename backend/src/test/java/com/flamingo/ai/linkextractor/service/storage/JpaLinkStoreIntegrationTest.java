package com.flamingo.ai.linkextractor.service.storage;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.tuple;

import co.elastic.clients.elasticsearch.ElasticsearchClient;
import com.flamingo.ai.linkextractor.domain.entity.LinkRecord;
import com.flamingo.ai.linkextractor.domain.enums.FetchStatus;
import com.flamingo.ai.linkextractor.domain.enums.TagCategory;
import com.flamingo.ai.linkextractor.domain.enums.TagSource;
import com.flamingo.ai.linkextractor.domain.repository.LinkRecordRepository;
import com.flamingo.ai.linkextractor.domain.repository.LinkTagRepository;
import com.flamingo.ai.linkextractor.domain.repository.ProcessingLogRepository;
import com.flamingo.ai.linkextractor.domain.repository.TagRepository;
import com.flamingo.ai.linkextractor.service.extraction.ExtractedLink;
import dev.langchain4j.model.chat.ChatModel;
import java.time.LocalDate;
import java.util.UUID;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.context.SpringBootTest;
import org.springframework.test.context.bean.override.mockito.MockitoBean;

/** Runs the JPA store against the SQLite test database. */
@SpringBootTest
class JpaLinkStoreIntegrationTest {

  @MockitoBean private ChatModel chatModel;
  @MockitoBean private ElasticsearchClient elasticsearchClient;

  @Autowired private LinkStore linkStore;
  @Autowired private LinkRecordRepository linkRepository;
  @Autowired private TagRepository tagRepository;
  @Autowired private LinkTagRepository linkTagRepository;
  @Autowired private ProcessingLogRepository processingLogRepository;

  @BeforeEach
  void cleanDatabase() {
    linkTagRepository.deleteAllInBatch();
    tagRepository.deleteAllInBatch();
    linkRepository.deleteAllInBatch();
    processingLogRepository.deleteAllInBatch();
  }

  @Test
  @DisplayName("should keep one record per URL")
  void shouldDeduplicateByUrl() {
    UUID first = linkStore.insertLink(link("https://example.com/a", LocalDate.of(2025, 1, 1)));
    UUID second = linkStore.insertLink(link("https://example.com/a", LocalDate.of(2025, 2, 1)));

    assertThat(second).isEqualTo(first);
    assertThat(linkStore.linkExists("https://example.com/a")).isTrue();
    assertThat(linkStore.stats().totalLinks()).isEqualTo(1);
    assertThat(linkStore.findById(first).orElseThrow().getSourceDate())
        .isEqualTo(LocalDate.of(2025, 1, 1));
  }

  @Test
  @DisplayName("should select batches by stage state, newest source date first")
  void shouldSelectByStageState() {
    UUID older = linkStore.insertLink(link("https://a.example.com", LocalDate.of(2025, 1, 1)));
    UUID newer = linkStore.insertLink(link("https://b.example.com", LocalDate.of(2025, 3, 1)));
    UUID pending = linkStore.insertLink(link("https://c.example.com", LocalDate.of(2025, 2, 1)));

    linkStore.updateFetchResult(older, FetchStatus.SUCCESS, "", "A", null);
    linkStore.updateFetchResult(newer, FetchStatus.SKIPPED, null, null, "media");

    assertThat(linkStore.findUnfetched(10)).extracting(LinkRecord::getId).containsExactly(pending);
    assertThat(linkStore.findUnsummarized(10))
        .extracting(LinkRecord::getId)
        .containsExactly(newer, older);
    assertThat(linkStore.findEmptyContent(10, 50))
        .extracting(LinkRecord::getId)
        .containsExactly(older);

    linkStore.updateSummary(newer, "Summary", "metadata");
    linkStore.addTag(older, "rust", TagCategory.PROGRAMMING_LANGUAGE, 0.8, TagSource.LLM);

    assertThat(linkStore.findUnsummarized(10)).extracting(LinkRecord::getId).containsExactly(older);
    assertThat(linkStore.findUntagged(10)).extracting(LinkRecord::getId).containsExactly(newer);
    assertThat(linkStore.findProcessed(10)).hasSize(2);
  }

  @Test
  @DisplayName("should upsert tag associations and count them per tag")
  void shouldUpsertTagsAndCount() {
    UUID a = linkStore.insertLink(link("https://a.example.com", LocalDate.of(2025, 1, 1)));
    UUID b = linkStore.insertLink(link("https://b.example.com", LocalDate.of(2025, 1, 2)));
    linkStore.updateFetchResult(a, FetchStatus.SUCCESS, "text", null, null);
    linkStore.updateFetchResult(b, FetchStatus.SUCCESS, "text", null, null);

    linkStore.addTag(a, "rust", TagCategory.PROGRAMMING_LANGUAGE, 0.5, TagSource.LLM);
    linkStore.addTag(a, "rust", TagCategory.PROGRAMMING_LANGUAGE, 0.9, TagSource.MANUAL);
    linkStore.addTag(b, "rust", TagCategory.PROGRAMMING_LANGUAGE, 0.7, TagSource.LLM);
    linkStore.addTag(b, "podcast", TagCategory.CULTURE, 0.6, TagSource.LLM);

    assertThat(linkStore.tagsFor(a))
        .singleElement()
        .satisfies(
            tag -> {
              assertThat(tag.getConfidence()).isEqualTo(0.9);
              assertThat(tag.getSource()).isEqualTo(TagSource.MANUAL);
            });
    assertThat(linkStore.tagCounts())
        .extracting(TagCount::name, TagCount::count)
        .containsExactly(tuple("rust", 2L), tuple("podcast", 1L));
    assertThat(linkStore.linksByTag("rust"))
        .extracting(LinkRecord::getId)
        .containsExactly(b, a);
    assertThat(linkStore.stats().tagged()).isEqualTo(2);

    assertThat(linkStore.clearAllTags()).isEqualTo(3);
    assertThat(linkStore.tagCounts()).extracting(TagCount::count).containsOnly(0L);
  }

  @Test
  @DisplayName("should remember processed files by content hash")
  void shouldTrackProcessedFiles() {
    assertThat(linkStore.fileNeedsProcessing("/notes/2025-01-01.md", "h1")).isTrue();

    linkStore.markFileProcessed("/notes/2025-01-01.md", "h1");
    assertThat(linkStore.fileNeedsProcessing("/notes/2025-01-01.md", "h1")).isFalse();

    linkStore.markFileProcessed("/notes/2025-01-01.md", "h2");
    assertThat(linkStore.fileNeedsProcessing("/notes/2025-01-01.md", "h1")).isTrue();
    assertThat(processingLogRepository.count()).isEqualTo(1);
  }

  @Test
  @DisplayName("should reset fetch state and keep the summary")
  void shouldResetFetchState() {
    UUID id = linkStore.insertLink(link("https://a.example.com", LocalDate.of(2025, 1, 1)));
    linkStore.updateFetchResult(id, FetchStatus.SUCCESS, "text", "Title", null);
    linkStore.updateSummary(id, "Summary", "gpt-test");

    linkStore.resetFetchStatus(id);

    LinkRecord link = linkStore.findById(id).orElseThrow();
    assertThat(link.getFetchStatus()).isEqualTo(FetchStatus.NOT_FETCHED);
    assertThat(link.getPageContent()).isNull();
    assertThat(link.getFetchedAt()).isNull();
    assertThat(link.getSummary()).isEqualTo("Summary");
  }

  @Test
  @DisplayName("should drop tagged links without tags from the backlog until tags are cleared")
  void shouldExcludeTaggedLinks_untilTagsCleared() {
    UUID newer = linkStore.insertLink(link("https://a.example.com", LocalDate.of(2025, 3, 1)));
    UUID older = linkStore.insertLink(link("https://b.example.com", LocalDate.of(2025, 1, 1)));
    linkStore.updateFetchResult(newer, FetchStatus.TIMEOUT, null, null, "timed out");
    linkStore.updateFetchResult(older, FetchStatus.SUCCESS, "text", null, null);

    linkStore.markTagged(newer);

    assertThat(linkStore.findUntagged(1)).extracting(LinkRecord::getId).containsExactly(older);
    assertThat(linkStore.findById(newer).orElseThrow().getTaggedAt()).isNotNull();

    linkStore.clearAllTags();

    assertThat(linkStore.findUntagged(10))
        .extracting(LinkRecord::getId)
        .containsExactly(newer, older);
  }

  private static ExtractedLink link(String url, LocalDate date) {
    return new ExtractedLink(url, null, null, date, "/notes/" + date + ".md", 0, null);
  }
}
