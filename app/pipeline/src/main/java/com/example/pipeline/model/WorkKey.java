/*
 * Where: pipeline domain model
 * What: identity of one unit of work (meeting + transcript)
 * Why: dedup and execution ids are both derived from it
 */
package com.example.pipeline.model;

import java.util.Objects;

public record WorkKey(String meetingId, String transcriptId) {

  public WorkKey {
    Objects.requireNonNull(meetingId, "meetingId");
    Objects.requireNonNull(transcriptId, "transcriptId");
  }

  public String value() {
    return meetingId + "-" + transcriptId;
  }

  @Override
  public String toString() {
    return value();
  }
}
