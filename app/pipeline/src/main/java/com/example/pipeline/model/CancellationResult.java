package com.example.pipeline.model;

public record CancellationResult(
    String executionId, CancellationOutcome outcome, String reason) {

  public boolean stopped() {
    return outcome == CancellationOutcome.STOPPED;
  }
}
