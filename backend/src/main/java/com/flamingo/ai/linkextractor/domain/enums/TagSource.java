package com.flamingo.ai.linkextractor.domain.enums;

import java.util.Locale;

/** Origin of a link-tag association. */
public enum TagSource {
  /** Assigned by the language-model tagger. */
  LLM,

  /** Assigned by hand. */
  MANUAL,

  /** Assigned by any other automatic rule. */
  AUTO;

  public String getValue() {
    return name().toLowerCase(Locale.ROOT);
  }
}
