package com.example.pipeline.subscription;

import java.time.Duration;

/**
 * Result of a retried call.
 *
 * @param value the call result, only set when {@code status} is {@code SUCCEEDED}
 * @param attempts number of attempts made
 * @param elapsed wall time across all attempts including waits
 * @param lastError last failure, {@code null} on success
 */
public record RetryOutcome<T>(
    Status status, T value, int attempts, Duration elapsed, Exception lastError) {

  public enum Status {
    SUCCEEDED,
    RETRIES_EXHAUSTED,
    NON_RETRYABLE,
    INTERRUPTED
  }

  public boolean succeeded() {
    return status == Status.SUCCEEDED;
  }
}
