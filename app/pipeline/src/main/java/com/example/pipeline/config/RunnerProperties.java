/*
 * Where: pipeline configuration binding
 * What: job-side runner settings (agent command, prompt file, cancellation check URL)
 * Why: the dispatcher hands these to the job as environment variables
 */
package com.example.pipeline.config;

import java.util.List;
import org.springframework.boot.context.properties.ConfigurationProperties;

@ConfigurationProperties(prefix = "pipeline.runner")
public record RunnerProperties(
    boolean enabled,
    List<String> command,
    String promptFile,
    String workingDirectory,
    String executionId,
    String checkCancelledUrl) {

  public RunnerProperties {
    command = command == null ? List.of() : List.copyOf(command);
  }
}
