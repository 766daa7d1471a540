package com.flamingo.ai.linkextractor.exception;

import java.time.Instant;
import lombok.Builder;
import lombok.Getter;

/** Structured API error response. */
@Getter
@Builder
public class ApiError {

  // Error codes
  public static final String LINK_NOT_FOUND = "LINK_001";
  public static final String PIPELINE_BUSY = "PIPELINE_001";
  public static final String PIPELINE_CONFIGURATION = "PIPELINE_002";
  public static final String LLM_UNAVAILABLE = "LLM_001";
  public static final String SEARCH_FAILED = "SEARCH_001";
  public static final String VALIDATION_ERROR = "VALIDATION_001";
  public static final String INTERNAL_ERROR = "INTERNAL_001";

  /** Unique error ID for log correlation. */
  private final String errorId;

  /** Machine-readable error code. */
  private final String code;

  /** User-friendly error message. */
  private final String message;

  /** Timestamp of the error. */
  private final Instant timestamp;

  /** Request path that caused the error. */
  private final String path;
}
