package com.flamingo.ai.linkextractor.service.enrichment;

import com.flamingo.ai.linkextractor.domain.entity.LinkRecord;
import com.flamingo.ai.linkextractor.exception.LlmServiceException;
import java.util.List;

/** Proposes vocabulary tags for a link. */
public interface Tagger {

  /**
   * Suggests tags for a link. An answer that cannot be read yields an empty list.
   *
   * @param link the link with whatever metadata and summary it has
   * @return suggestions restricted to {@link TagVocabulary}, possibly empty
   * @throws LlmServiceException if the model could not be reached
   */
  List<TagSuggestion> tag(LinkRecord link);
}
