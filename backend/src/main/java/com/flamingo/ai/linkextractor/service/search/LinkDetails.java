package com.flamingo.ai.linkextractor.service.search;

import com.flamingo.ai.linkextractor.domain.entity.LinkRecord;
import com.flamingo.ai.linkextractor.domain.entity.LinkTag;
import java.util.List;

/** A link together with its tags, highest confidence first. */
public record LinkDetails(LinkRecord link, List<LinkTag> tags) {}
