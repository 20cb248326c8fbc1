package com.example.pipeline.supervisor;

public enum SupervisorState {
  STARTING,
  RUNNING,
  SUCCEEDED,
  FAILED,
  TIMED_OUT,
  CANCELLED;

  public boolean isTerminal() {
    return this != STARTING && this != RUNNING;
  }
}
