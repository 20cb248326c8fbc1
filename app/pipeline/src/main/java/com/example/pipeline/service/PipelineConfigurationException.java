package com.example.pipeline.service;

import java.util.List;

/** Required configuration is missing; names every missing key at once. */
public class PipelineConfigurationException extends RuntimeException {

  private final List<String> missingKeys;

  public PipelineConfigurationException(List<String> missingKeys) {
    super("missing required configuration: " + String.join(", ", missingKeys));
    this.missingKeys = List.copyOf(missingKeys);
  }

  public List<String> missingKeys() {
    return missingKeys;
  }
}
