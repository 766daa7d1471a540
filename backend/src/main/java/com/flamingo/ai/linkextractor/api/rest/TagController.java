package com.flamingo.ai.linkextractor.api.rest;

import com.flamingo.ai.linkextractor.api.dto.response.LinkResponse;
import com.flamingo.ai.linkextractor.api.dto.response.RetagResponse;
import com.flamingo.ai.linkextractor.api.dto.response.TagCountResponse;
import com.flamingo.ai.linkextractor.service.maintenance.LinkMaintenanceService;
import com.flamingo.ai.linkextractor.service.search.LinkSearchService;
import java.util.List;
import lombok.RequiredArgsConstructor;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;

/** REST controller for the tag catalogue. */
@RestController
@RequestMapping("/api/tags")
@RequiredArgsConstructor
public class TagController {

  private final LinkSearchService searchService;
  private final LinkMaintenanceService maintenanceService;

  /** All tags with the number of links carrying them, most used first. */
  @GetMapping
  public ResponseEntity<List<TagCountResponse>> getTags() {
    return ResponseEntity.ok(
        searchService.tagCounts().stream().map(TagCountResponse::from).toList());
  }

  /** Links carrying a tag, newest first. */
  @GetMapping("/{tagName}/links")
  public ResponseEntity<List<LinkResponse>> getLinksByTag(@PathVariable String tagName) {
    return ResponseEntity.ok(
        searchService.linksByTag(tagName).stream().map(LinkResponse::fromEntity).toList());
  }

  /** Tags every processed link again. */
  @PostMapping("/retag")
  public ResponseEntity<RetagResponse> retag(
      @RequestParam(defaultValue = "false") boolean clearExisting,
      @RequestParam(required = false) Integer limit) {
    return ResponseEntity.ok(
        RetagResponse.fromResult(maintenanceService.retag(clearExisting, limit)));
  }
}
