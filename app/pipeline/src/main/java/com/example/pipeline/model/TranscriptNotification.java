/*
 * Where: pipeline domain model
 * What: one accepted transcript notification, as carried on the queue
 * Why: the webhook extracts exactly these identifiers and the job needs nothing else
 */
package com.example.pipeline.model;

import com.fasterxml.jackson.annotation.JsonIgnore;
import com.fasterxml.jackson.databind.PropertyNamingStrategies;
import com.fasterxml.jackson.databind.annotation.JsonNaming;
import java.time.Instant;

@JsonNaming(PropertyNamingStrategies.SnakeCaseStrategy.class)
public record TranscriptNotification(
    String userId, String meetingId, String transcriptId, Instant receivedAt) {

  @JsonIgnore
  public WorkKey workKey() {
    return new WorkKey(meetingId, transcriptId);
  }

  @JsonIgnore
  public boolean isComplete() {
    return !isBlank(userId) && !isBlank(meetingId) && !isBlank(transcriptId);
  }

  private static boolean isBlank(String value) {
    return value == null || value.isBlank();
  }
}
