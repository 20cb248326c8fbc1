package com.example.pipeline.supervisor;

import java.time.Duration;

/**
 * Outcome of one supervised process.
 *
 * @param exitCode process exit code, {@code null} when the process never started
 * @param resultToken extracted result token, {@code null} when the output carried none
 * @param stderr captured error-stream content
 * @param message human-readable reason for non-success states
 */
public record SupervisionResult(
    SupervisorState state,
    Integer exitCode,
    String resultToken,
    String stderr,
    String message,
    Duration elapsed) {

  public boolean hasResultToken() {
    return resultToken != null && !resultToken.isEmpty();
  }
}
