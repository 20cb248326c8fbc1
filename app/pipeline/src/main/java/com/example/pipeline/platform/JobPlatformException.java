/*
 * Where: pipeline platform layer
 * What: failure of a job-platform call, tagged with a reason
 * Why: cancellation treats NOT_FOUND as "already completed" and everything else as a failure
 */
package com.example.pipeline.platform;

public class JobPlatformException extends RuntimeException {

  public enum Reason {
    NOT_FOUND,
    AUTHENTICATION,
    TIMEOUT,
    INVALID_RESPONSE,
    BAD_GATEWAY
  }

  private final Reason reason;

  public JobPlatformException(Reason reason, String message) {
    super(message);
    this.reason = reason;
  }

  public JobPlatformException(Reason reason, String message, Throwable cause) {
    super(message, cause);
    this.reason = reason;
  }

  public Reason reason() {
    return reason;
  }
}
