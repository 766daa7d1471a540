package com.flamingo.ai.linkextractor.service.enrichment;

import com.flamingo.ai.linkextractor.agent.LinkSummaryAgent;
import com.flamingo.ai.linkextractor.config.LinkExtractorConfig;
import com.flamingo.ai.linkextractor.exception.LlmServiceException;
import io.github.resilience4j.circuitbreaker.annotation.CircuitBreaker;
import io.github.resilience4j.retry.annotation.Retry;
import io.micrometer.core.annotation.Timed;
import io.micrometer.core.instrument.MeterRegistry;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Service;

/** {@link Summarizer} backed by the {@link LinkSummaryAgent}. */
@Service
@Slf4j
public class LlmSummarizer implements Summarizer {

  private final LinkSummaryAgent summaryAgent;
  private final MeterRegistry meterRegistry;
  private final int maxInputChars;
  private final String modelName;

  public LlmSummarizer(
      LinkSummaryAgent summaryAgent,
      LinkExtractorConfig config,
      MeterRegistry meterRegistry,
      @Value("${langchain4j.openai.chat-model.model-name:gpt-5-mini}") String modelName) {
    this.summaryAgent = summaryAgent;
    this.meterRegistry = meterRegistry;
    this.maxInputChars = config.getSummary().getMaxInputChars();
    this.modelName = modelName;
  }

  @Override
  @Timed(value = "link.summarize", description = "Time to summarize a link")
  @CircuitBreaker(name = "openai", fallbackMethod = "summarizeFallback")
  @Retry(name = "openai")
  public String summarize(String content, String title, String description, String url) {
    String input =
        content.length() > maxInputChars ? content.substring(0, maxInputChars) + "..." : content;

    String summary;
    try {
      summary =
          summaryAgent.summarize(
              title != null ? title : "Unknown",
              url != null ? url : "Unknown",
              description != null ? description : "None provided",
              input);
    } catch (RuntimeException e) {
      meterRegistry.counter("link.summarize.errors").increment();
      throw new LlmServiceException("Summary generation failed for " + url, e);
    }

    if (summary == null || summary.isBlank()) {
      meterRegistry.counter("link.summarize.errors").increment();
      throw new LlmServiceException("Model returned an empty summary for " + url);
    }
    log.debug("Summarized {} ({} chars in, {} chars out)", url, input.length(), summary.length());
    return summary.strip();
  }

  @SuppressWarnings("unused")
  private String summarizeFallback(
      String content, String title, String description, String url, Throwable t) {
    log.warn("Summary fallback triggered for {}: {}", url, t.getMessage());
    if (t instanceof LlmServiceException e) {
      throw e;
    }
    throw new LlmServiceException("Summary service unavailable for " + url, t);
  }

  @Override
  public String modelName() {
    return modelName;
  }
}
