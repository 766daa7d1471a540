package com.flamingo.ai.linkextractor.exception;

/** Exception thrown when downloaded content cannot be turned into text. */
public class ContentFetchException extends RuntimeException {

  private final String url;

  public ContentFetchException(String url, String message, Throwable cause) {
    super(message, cause);
    this.url = url;
  }

  public String getUrl() {
    return url;
  }
}
