package com.flamingo.ai.linkextractor.service.maintenance;

import com.flamingo.ai.linkextractor.domain.entity.LinkRecord;
import java.util.List;

/**
 * Outcome of a refetch request.
 *
 * @param candidates successful fetches with missing or too little content
 * @param reset links returned to {@code not_fetched}; 0 on a dry run
 * @param dryRun whether anything was changed
 */
public record RefetchResult(List<LinkRecord> candidates, int reset, boolean dryRun) {}
