package com.flamingo.ai.linkextractor.exception;

/** Exception thrown when the link search index cannot be read or written. */
public class SearchException extends RuntimeException {

  private final String userMessage;

  public SearchException(String message, Throwable cause) {
    super(message, cause);
    this.userMessage = "Search is temporarily unavailable. Please try again.";
  }

  public String getUserMessage() {
    return userMessage;
  }
}
