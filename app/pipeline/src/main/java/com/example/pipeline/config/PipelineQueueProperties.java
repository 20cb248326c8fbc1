/*
 * Where: pipeline configuration binding
 * What: JetStream queue settings (subject/stream/durable/duplicate-window/ack-wait/max-deliver)
 * Why: the redelivery window and the retry-then-dead-letter limit are operational knobs
 */
package com.example.pipeline.config;

import jakarta.validation.constraints.AssertTrue;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotNull;
import jakarta.validation.constraints.Positive;
import java.time.Duration;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.validation.annotation.Validated;

@ConfigurationProperties(prefix = "pipeline.queue")
@Validated
public record PipelineQueueProperties(
    @NotBlank String subject,
    @NotBlank String stream,
    @NotBlank String durable,
    @NotNull Duration duplicateWindow,
    @NotNull Duration ackWait,
    @NotNull @Positive Integer maxDeliver) {

  @AssertTrue(message = "pipeline.queue.duplicate-window must be positive")
  public boolean isDuplicateWindowPositive() {
    return isPositiveDuration(duplicateWindow);
  }

  @AssertTrue(message = "pipeline.queue.ack-wait must be positive")
  public boolean isAckWaitPositive() {
    // ack-wait bounds how long a delivery may stay unacked before redelivery
    return isPositiveDuration(ackWait);
  }

  private boolean isPositiveDuration(Duration duration) {
    return duration != null && !duration.isZero() && !duration.isNegative();
  }
}
