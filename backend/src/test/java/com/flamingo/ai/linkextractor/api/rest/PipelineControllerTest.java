package com.flamingo.ai.linkextractor.api.rest;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.get;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.post;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.jsonPath;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.status;

import com.flamingo.ai.linkextractor.exception.ApiError;
import com.flamingo.ai.linkextractor.exception.GlobalExceptionHandler;
import com.flamingo.ai.linkextractor.exception.PipelineBusyException;
import com.flamingo.ai.linkextractor.exception.PipelineConfigurationException;
import com.flamingo.ai.linkextractor.service.pipeline.LinkPipelineService;
import com.flamingo.ai.linkextractor.service.pipeline.PipelineOptions;
import com.flamingo.ai.linkextractor.service.pipeline.PipelineRunResult;
import com.flamingo.ai.linkextractor.service.storage.LinkStats;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.ArgumentCaptor;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import org.springframework.http.MediaType;
import org.springframework.test.web.servlet.MockMvc;
import org.springframework.test.web.servlet.setup.MockMvcBuilders;

@ExtendWith(MockitoExtension.class)
class PipelineControllerTest {

  private static final PipelineRunResult RESULT =
      new PipelineRunResult(3, 2, 10, 4, 4, 3, 2, 5, new LinkStats(40, 30, 25, 20));

  @Mock private LinkPipelineService pipelineService;

  private SimpleMeterRegistry meterRegistry;
  private MockMvc mockMvc;

  @BeforeEach
  void setUp() {
    meterRegistry = new SimpleMeterRegistry();
    mockMvc =
        MockMvcBuilders.standaloneSetup(
                new PipelineController(pipelineService), new HealthController(pipelineService))
            .setControllerAdvice(new GlobalExceptionHandler(meterRegistry))
            .build();
  }

  @Test
  @DisplayName("should run every stage with defaults when no body is sent")
  void shouldRunWithDefaults_whenBodyMissing() throws Exception {
    when(pipelineService.run(PipelineOptions.defaults())).thenReturn(RESULT);

    mockMvc
        .perform(post("/api/pipeline/run"))
        .andExpect(status().isOk())
        .andExpect(jsonPath("$.filesFound").value(3))
        .andExpect(jsonPath("$.newLinks").value(4))
        .andExpect(jsonPath("$.tagsApplied").value(5))
        .andExpect(jsonPath("$.stats.totalLinks").value(40));
  }

  @Test
  @DisplayName("should pass stage switches and date bounds to the pipeline")
  void shouldPassOptions_whenBodyGiven() throws Exception {
    when(pipelineService.run(any())).thenReturn(RESULT);

    mockMvc
        .perform(
            post("/api/pipeline/run")
                .contentType(MediaType.APPLICATION_JSON)
                .content(
                    """
                    {"fetch": false, "tag": false, "skipExisting": false,
                     "dateFrom": "2025-01-01", "dateTo": "2025-01-31"}
                    """))
        .andExpect(status().isOk());

    ArgumentCaptor<PipelineOptions> options = ArgumentCaptor.forClass(PipelineOptions.class);
    verify(pipelineService).run(options.capture());
    assertThat(options.getValue())
        .isEqualTo(new PipelineOptions(false, true, false, false, "2025-01-01", "2025-01-31"));
  }

  @Test
  @DisplayName("should reject malformed dates before running")
  void shouldReturnBadRequest_whenDateMalformed() throws Exception {
    mockMvc
        .perform(
            post("/api/pipeline/run")
                .contentType(MediaType.APPLICATION_JSON)
                .content("{\"dateFrom\": \"01/02/2025\"}"))
        .andExpect(status().isBadRequest())
        .andExpect(jsonPath("$.code").value(ApiError.VALIDATION_ERROR))
        .andExpect(
            jsonPath("$.message").value("dateFrom: dateFrom must be formatted as YYYY-MM-DD"));

    verify(pipelineService, never()).run(any());
  }

  @Test
  @DisplayName("should answer 409 while another run is in progress")
  void shouldReturnConflict_whenPipelineBusy() throws Exception {
    when(pipelineService.run(any())).thenThrow(new PipelineBusyException());

    mockMvc
        .perform(post("/api/pipeline/run"))
        .andExpect(status().isConflict())
        .andExpect(jsonPath("$.code").value(ApiError.PIPELINE_BUSY));

    assertThat(meterRegistry.counter("api_errors_total", "error_type", "pipeline_busy").count())
        .isEqualTo(1.0);
  }

  @Test
  @DisplayName("should answer 500 with a hint when the notes path is missing")
  void shouldReturnServerError_whenNotConfigured() throws Exception {
    when(pipelineService.run(any()))
        .thenThrow(new PipelineConfigurationException("Notes path is not configured."));

    mockMvc
        .perform(post("/api/pipeline/run"))
        .andExpect(status().isInternalServerError())
        .andExpect(jsonPath("$.code").value(ApiError.PIPELINE_CONFIGURATION))
        .andExpect(jsonPath("$.message").value("Notes path is not configured."));
  }

  @Test
  @DisplayName("should report whether a run is in progress")
  void shouldReportStatus() throws Exception {
    when(pipelineService.isRunning()).thenReturn(true);

    mockMvc
        .perform(get("/api/pipeline/status"))
        .andExpect(status().isOk())
        .andExpect(jsonPath("$.running").value(true));
  }

  @Test
  @DisplayName("should expose a health endpoint")
  void shouldReturnHealth() throws Exception {
    mockMvc
        .perform(get("/health"))
        .andExpect(status().isOk())
        .andExpect(jsonPath("$.status").value("UP"))
        .andExpect(jsonPath("$.service").value("link-extractor"))
        .andExpect(jsonPath("$.pipelineRunning").value(false));
  }
}
