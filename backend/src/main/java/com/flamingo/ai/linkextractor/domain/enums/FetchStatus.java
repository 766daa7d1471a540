package com.flamingo.ai.linkextractor.domain.enums;

import java.util.Arrays;

/** Outcome of attempting to retrieve a link's content. */
public enum FetchStatus {
  /** Link has been recorded but no fetch was attempted yet. */
  NOT_FETCHED("not_fetched"),

  /** Content was retrieved and extracted. */
  SUCCESS("success"),

  /** Transport or HTTP level failure. */
  FAILED("failed"),

  /** The request did not complete within the configured timeout. */
  TIMEOUT("timeout"),

  /** Fetch was not attempted or its result discarded by policy (media, wrong content type). */
  SKIPPED("skipped");

  private final String value;

  FetchStatus(String value) {
    this.value = value;
  }

  /** Returns the lower-case name stored in the database. */
  public String getValue() {
    return value;
  }

  /** Resolves a stored value back to its status. */
  public static FetchStatus fromValue(String value) {
    return Arrays.stream(values())
        .filter(status -> status.value.equals(value))
        .findFirst()
        .orElseThrow(() -> new IllegalArgumentException("Unknown fetch status: " + value));
  }
}
