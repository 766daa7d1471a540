package com.flamingo.ai.linkextractor.domain.enums;

import java.util.Arrays;
import java.util.Locale;
import java.util.Optional;

/** Fixed set of categories a tag may belong to. */
public enum TagCategory {
  PROGRAMMING_LANGUAGE,
  TECHNICAL_TOPIC,
  CULTURE;

  /** Returns the snake_case name used in prompts and API responses. */
  public String getValue() {
    return name().toLowerCase(Locale.ROOT);
  }

  /** Looks up a category by its snake_case name, ignoring case and surrounding whitespace. */
  public static Optional<TagCategory> fromValue(String value) {
    if (value == null) {
      return Optional.empty();
    }
    String normalized = value.trim().toLowerCase(Locale.ROOT);
    return Arrays.stream(values()).filter(c -> c.getValue().equals(normalized)).findFirst();
  }
}
