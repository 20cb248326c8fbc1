package com.example.pipeline.model;

import java.util.List;

public record JobStartRequest(
    String jobName, String containerName, String image, List<JobParameter> parameters) {

  public JobStartRequest {
    parameters = parameters == null ? List.of() : List.copyOf(parameters);
  }
}
