package com.flamingo.ai.linkextractor.service.storage;

import com.flamingo.ai.linkextractor.domain.entity.LinkRecord;
import com.flamingo.ai.linkextractor.domain.entity.LinkTag;
import com.flamingo.ai.linkextractor.domain.enums.FetchStatus;
import com.flamingo.ai.linkextractor.domain.enums.TagCategory;
import com.flamingo.ai.linkextractor.domain.enums.TagSource;
import com.flamingo.ai.linkextractor.service.extraction.ExtractedLink;
import java.util.List;
import java.util.Optional;
import java.util.UUID;

/**
 * Persistence contract of the link pipeline.
 *
 * <p>Every mutation is atomic on its own. Batch queries return at most {@code limit} links, newest
 * source date first.
 */
public interface LinkStore {

  boolean linkExists(String url);

  /**
   * Creates a record in the {@code not_fetched} state. When the URL is already stored nothing is
   * changed and the existing id is returned.
   *
   * @param link the parsed link
   * @return the id of the record holding the URL
   */
  UUID insertLink(ExtractedLink link);

  void updateFetchResult(
      UUID linkId, FetchStatus status, String content, String pageTitle, String error);

  void updateSummary(UUID linkId, String summary, String modelName);

  /**
   * Associates a tag with a link, creating the catalogue tag on first use. Re-adding an existing
   * pair overwrites its confidence and source.
   */
  void addTag(
      UUID linkId, String tagName, TagCategory category, double confidence, TagSource source);

  /** True when the file was never processed or its content hash changed since. */
  boolean fileNeedsProcessing(String sourceFile, String fileHash);

  void markFileProcessed(String sourceFile, String fileHash);

  List<LinkRecord> findUnfetched(int limit);

  /** Links past the fetch stage, whatever its outcome, that have no summary. */
  List<LinkRecord> findUnsummarized(int limit);

  /** Links past the fetch stage that were never tagged and carry no tag. */
  List<LinkRecord> findUntagged(int limit);

  /** Successful fetches with missing content or content shorter than {@code minLength}. */
  List<LinkRecord> findEmptyContent(int limit, int minLength);

  /** Links past the fetch stage, whatever its outcome. */
  List<LinkRecord> findProcessed(int limit);

  void resetFetchStatus(UUID linkId);

  /** Records that the tag stage completed for the link, even when it produced no tag. */
  void markTagged(UUID linkId);

  /**
   * Removes every link-tag association and returns every link to the untagged state. Catalogue
   * tags are kept.
   *
   * @return number of associations removed
   */
  int clearAllTags();

  Optional<LinkRecord> findById(UUID linkId);

  /** Links with the given ids, in the order of the ids. Unknown ids are skipped. */
  List<LinkRecord> findAllByIds(List<UUID> linkIds);

  /** Tags of a link, highest confidence first. */
  List<LinkTag> tagsFor(UUID linkId);

  List<LinkRecord> linksByTag(String tagName);

  List<TagCount> tagCounts();

  LinkStats stats();
}
