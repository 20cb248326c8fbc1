/*
 * Where: pipeline configuration validation test
 * What: Bean Validation of the JetStream queue and webhook settings
 * Why: a zero ack-wait or a blank client state must stop startup
 */
package com.example.pipeline.config;

import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertTrue;

import jakarta.validation.Validation;
import jakarta.validation.Validator;
import java.time.Duration;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

class PipelineQueuePropertiesValidationTest {

  private static final String SUBJECT = "transcript.notifications";
  private static final String STREAM = "TRANSCRIPT_NOTIFICATIONS";
  private static final String DURABLE = "pipeline-transcript-consumer";
  private static final Duration DUPLICATE_WINDOW = Duration.ofMinutes(2);
  private static final Duration ACK_WAIT = Duration.ofMinutes(2);
  private static final int MAX_DELIVER = 5;

  private Validator validator;

  @BeforeEach
  void setUp() {
    validator = Validation.buildDefaultValidatorFactory().getValidator();
  }

  @Test
  void validationPassesWhenAllFieldsValid() {
    final PipelineQueueProperties properties =
        new PipelineQueueProperties(
            SUBJECT, STREAM, DURABLE, DUPLICATE_WINDOW, ACK_WAIT, MAX_DELIVER);

    assertTrue(validator.validate(properties).isEmpty());
  }

  @Test
  void validationFailsWhenAckWaitIsZero() {
    final PipelineQueueProperties properties =
        new PipelineQueueProperties(
            SUBJECT, STREAM, DURABLE, DUPLICATE_WINDOW, Duration.ZERO, MAX_DELIVER);

    assertFalse(validator.validate(properties).isEmpty());
  }

  @Test
  void validationFailsWhenDuplicateWindowIsNegative() {
    final PipelineQueueProperties properties =
        new PipelineQueueProperties(
            SUBJECT, STREAM, DURABLE, Duration.ofSeconds(-1), ACK_WAIT, MAX_DELIVER);

    assertFalse(validator.validate(properties).isEmpty());
  }

  @Test
  void validationFailsWhenMaxDeliverIsZero() {
    final PipelineQueueProperties properties =
        new PipelineQueueProperties(SUBJECT, STREAM, DURABLE, DUPLICATE_WINDOW, ACK_WAIT, 0);

    assertFalse(validator.validate(properties).isEmpty());
  }

  @Test
  void validationFailsWhenClientStateIsBlank() {
    assertFalse(validator.validate(new WebhookProperties(" ", "callTranscript")).isEmpty());
    assertTrue(validator.validate(new WebhookProperties("secret", "callTranscript")).isEmpty());
  }

  @Test
  void validationFailsWhenDedupTtlIsMissing() {
    final PipelineCacheProperties properties =
        new PipelineCacheProperties(null, Duration.ofHours(2), Duration.ofMinutes(30));

    assertFalse(validator.validate(properties).isEmpty());
  }
}
