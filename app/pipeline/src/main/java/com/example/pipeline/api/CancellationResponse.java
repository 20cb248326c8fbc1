package com.example.pipeline.api;

import com.example.pipeline.model.CancellationResult;
import com.fasterxml.jackson.databind.PropertyNamingStrategies;
import com.fasterxml.jackson.databind.annotation.JsonNaming;

@JsonNaming(PropertyNamingStrategies.SnakeCaseStrategy.class)
public record CancellationResponse(
    String executionId, boolean stopped, String outcome, String reason) {

  static CancellationResponse from(CancellationResult result) {
    return new CancellationResponse(
        result.executionId(), result.stopped(), result.outcome().name(), result.reason());
  }
}
