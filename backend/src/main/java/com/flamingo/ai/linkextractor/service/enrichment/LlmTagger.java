package com.flamingo.ai.linkextractor.service.enrichment;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.flamingo.ai.linkextractor.agent.LinkTaggingAgent;
import com.flamingo.ai.linkextractor.domain.entity.LinkRecord;
import com.flamingo.ai.linkextractor.domain.enums.TagCategory;
import com.flamingo.ai.linkextractor.exception.LlmServiceException;
import io.micrometer.core.annotation.Timed;
import io.micrometer.core.instrument.MeterRegistry;
import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import java.util.Optional;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

/**
 * {@link Tagger} backed by the {@link LinkTaggingAgent}.
 *
 * <p>A failed model call raises {@link LlmServiceException}. The answer is parsed leniently: a
 * surrounding markdown code fence is removed, entries outside {@link TagVocabulary} are dropped
 * and confidences are clamped to [0, 1].
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class LlmTagger implements Tagger {

  static final double DEFAULT_CONFIDENCE = 0.5;

  private final LinkTaggingAgent taggingAgent;
  private final ObjectMapper objectMapper;
  private final MeterRegistry meterRegistry;

  @Override
  @Timed(value = "link.tag", description = "Time to tag a link")
  public List<TagSuggestion> tag(LinkRecord link) {
    String response;
    try {
      response =
          taggingAgent.tag(
              TagVocabulary.describe(),
              firstNonBlank(link.getTitle(), link.getPageTitle(), "Unknown"),
              link.getUrl(),
              link.getDomain(),
              firstNonBlank(link.getDescription(), "None"),
              firstNonBlank(link.getSummary(), "None"));
    } catch (RuntimeException e) {
      log.error("LLM tagging failed for {}: {}", link.getUrl(), e.getMessage());
      meterRegistry.counter("link.tag.errors").increment();
      throw new LlmServiceException("Tagging failed for " + link.getUrl(), e);
    }
    return parseResponse(response);
  }

  /** Turns the model answer into validated suggestions; malformed answers give an empty list. */
  List<TagSuggestion> parseResponse(String response) {
    if (response == null || response.isBlank()) {
      return List.of();
    }

    JsonNode root;
    try {
      root = objectMapper.readTree(stripCodeFence(response.strip()));
    } catch (JsonProcessingException e) {
      log.error("Failed to parse tagging response: {}", e.getOriginalMessage());
      log.debug("Response was: {}", response);
      return List.of();
    }

    JsonNode tags = root.path("tags");
    if (!tags.isArray()) {
      log.warn("Tagging response has no tags array");
      return List.of();
    }

    List<TagSuggestion> suggestions = new ArrayList<>();
    for (JsonNode entry : tags) {
      String name = entry.path("name").asText("").strip().toLowerCase(Locale.ROOT);
      String categoryValue = entry.path("category").asText("");

      Optional<TagCategory> category = TagCategory.fromValue(categoryValue);
      if (category.isEmpty()) {
        log.warn("Unknown category: {}", categoryValue);
        continue;
      }
      if (!TagVocabulary.contains(category.get(), name)) {
        log.warn("Unknown tag: {} in {}", name, category.get().getValue());
        continue;
      }
      suggestions.add(new TagSuggestion(name, category.get(), confidenceOf(entry)));
    }
    return suggestions;
  }

  private static double confidenceOf(JsonNode entry) {
    JsonNode node = entry.get("confidence");
    double confidence = DEFAULT_CONFIDENCE;
    if (node != null && node.isNumber()) {
      confidence = node.asDouble();
    } else if (node != null && node.isTextual()) {
      try {
        confidence = Double.parseDouble(node.asText().strip());
      } catch (NumberFormatException e) {
        log.debug("Unreadable confidence '{}', using default", node.asText());
      }
    }
    return Math.max(0.0, Math.min(1.0, confidence));
  }

  /** Drops an opening {@code ```lang} line and a closing {@code ```} line. */
  static String stripCodeFence(String response) {
    if (!response.startsWith("```")) {
      return response;
    }
    int firstNewline = response.indexOf('\n');
    if (firstNewline < 0) {
      return "";
    }
    String body = response.substring(firstNewline + 1);
    int closing = body.lastIndexOf("```");
    return closing >= 0 ? body.substring(0, closing) : body;
  }

  private static String firstNonBlank(String... values) {
    for (String value : values) {
      if (value != null && !value.isBlank()) {
        return value;
      }
    }
    return null;
  }
}
