package com.example.pipeline.model;

public enum CancellationOutcome {
  STOPPED,
  ALREADY_COMPLETED,
  NOT_RUNNING,
  CONFLICT,
  STOP_FAILED
}
