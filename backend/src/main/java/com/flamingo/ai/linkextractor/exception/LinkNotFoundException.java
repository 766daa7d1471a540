package com.flamingo.ai.linkextractor.exception;

import java.util.UUID;

/** Exception thrown when a link record is not found. */
public class LinkNotFoundException extends RuntimeException {

  private final UUID linkId;

  public LinkNotFoundException(UUID linkId) {
    super("Link not found: " + linkId);
    this.linkId = linkId;
  }

  public UUID getLinkId() {
    return linkId;
  }
}
