package com.flamingo.ai.linkextractor.api.rest;

import com.flamingo.ai.linkextractor.api.dto.request.PipelineRunRequest;
import com.flamingo.ai.linkextractor.api.dto.response.PipelineRunResponse;
import com.flamingo.ai.linkextractor.service.pipeline.LinkPipelineService;
import com.flamingo.ai.linkextractor.service.pipeline.PipelineOptions;
import com.flamingo.ai.linkextractor.service.pipeline.PipelineRunResult;
import jakarta.validation.Valid;
import java.util.Map;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

/** REST controller for running the link pipeline. */
@RestController
@RequestMapping("/api/pipeline")
@RequiredArgsConstructor
@Slf4j
public class PipelineController {

  private final LinkPipelineService pipelineService;

  /**
   * Runs extract, fetch, summarize and tag once and returns the totals. Blocks until the run is
   * finished; a concurrent request gets 409.
   */
  @PostMapping("/run")
  public ResponseEntity<PipelineRunResponse> run(
      @Valid @RequestBody(required = false) PipelineRunRequest request) {
    PipelineOptions options = request != null ? request.toOptions() : PipelineOptions.defaults();
    log.info("Pipeline run requested: {}", options);
    PipelineRunResult result = pipelineService.run(options);
    return ResponseEntity.ok(PipelineRunResponse.fromResult(result));
  }

  /** Whether a run is in progress. */
  @GetMapping("/status")
  public ResponseEntity<Map<String, Object>> status() {
    return ResponseEntity.ok(Map.of("running", pipelineService.isRunning()));
  }
}
