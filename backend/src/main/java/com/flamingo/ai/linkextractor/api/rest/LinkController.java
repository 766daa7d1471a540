package com.flamingo.ai.linkextractor.api.rest;

import com.flamingo.ai.linkextractor.api.dto.response.LinkResponse;
import com.flamingo.ai.linkextractor.api.dto.response.RefetchResponse;
import com.flamingo.ai.linkextractor.api.dto.response.StatsResponse;
import com.flamingo.ai.linkextractor.service.maintenance.LinkMaintenanceService;
import com.flamingo.ai.linkextractor.service.search.LinkSearchService;
import java.util.List;
import java.util.UUID;
import lombok.RequiredArgsConstructor;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;

/** REST controller for searching, reading and repairing links. */
@RestController
@RequestMapping("/api")
@RequiredArgsConstructor
public class LinkController {

  private final LinkSearchService searchService;
  private final LinkMaintenanceService maintenanceService;

  /** Full-text search over links. */
  @GetMapping("/links/search")
  public ResponseEntity<List<LinkResponse>> search(
      @RequestParam("q") String query, @RequestParam(required = false) Integer limit) {
    List<LinkResponse> responses =
        searchService.search(query, limit).stream().map(LinkResponse::fromEntity).toList();
    return ResponseEntity.ok(responses);
  }

  /** Gets a link with its page content and tags. */
  @GetMapping("/links/{linkId}")
  public ResponseEntity<LinkResponse> getLink(@PathVariable UUID linkId) {
    return ResponseEntity.ok(LinkResponse.fromDetails(searchService.getLink(linkId)));
  }

  /** Resets successful fetches with empty content so the next run fetches them again. */
  @PostMapping("/links/refetch")
  public ResponseEntity<RefetchResponse> refetch(
      @RequestParam(required = false) Integer limit,
      @RequestParam(defaultValue = "false") boolean dryRun) {
    return ResponseEntity.ok(RefetchResponse.fromResult(maintenanceService.refetch(limit, dryRun)));
  }

  /** Store-wide counters. */
  @GetMapping("/stats")
  public ResponseEntity<StatsResponse> stats() {
    return ResponseEntity.ok(StatsResponse.from(searchService.stats()));
  }
}
