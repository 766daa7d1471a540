package com.flamingo.ai.linkextractor.exception;

/** Exception thrown when the pipeline cannot start because its configuration is unusable. */
public class PipelineConfigurationException extends RuntimeException {

  public PipelineConfigurationException(String message) {
    super(message);
  }
}
