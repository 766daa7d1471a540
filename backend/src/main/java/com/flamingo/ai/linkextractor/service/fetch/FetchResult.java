package com.flamingo.ai.linkextractor.service.fetch;

import com.flamingo.ai.linkextractor.domain.enums.FetchStatus;
import java.time.LocalDateTime;

/**
 * Outcome of one fetch attempt. Exactly one of success, failed, timeout or skipped.
 *
 * @param status the outcome, never {@link FetchStatus#NOT_FETCHED}
 * @param content extracted readable text, only set on success
 * @param title page or document title, if one was found
 * @param error diagnostic text for anything but success
 * @param contentType response content type when known
 * @param fetchedAt when the attempt finished
 */
public record FetchResult(
    FetchStatus status,
    String content,
    String title,
    String error,
    String contentType,
    LocalDateTime fetchedAt) {

  public static FetchResult success(String content, String title, String contentType) {
    return new FetchResult(
        FetchStatus.SUCCESS, content, title, null, contentType, LocalDateTime.now());
  }

  public static FetchResult failed(String error) {
    return new FetchResult(FetchStatus.FAILED, null, null, error, null, LocalDateTime.now());
  }

  public static FetchResult timeout(String error) {
    return new FetchResult(FetchStatus.TIMEOUT, null, null, error, null, LocalDateTime.now());
  }

  public static FetchResult skipped(String reason, String contentType) {
    return new FetchResult(
        FetchStatus.SKIPPED, null, null, reason, contentType, LocalDateTime.now());
  }

  public boolean isSuccess() {
    return status == FetchStatus.SUCCESS;
  }
}
