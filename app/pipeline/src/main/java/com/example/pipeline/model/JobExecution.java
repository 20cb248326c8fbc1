package com.example.pipeline.model;

import java.util.Locale;

/** Platform view of one job execution. */
public record JobExecution(String name, String status) {

  public static final String STATUS_RUNNING = "Running";
  public static final String STATUS_PROCESSING = "Processing";

  public boolean isActive() {
    if (status == null) {
      return false;
    }
    final String normalized = status.toLowerCase(Locale.ROOT);
    return normalized.equals("running") || normalized.equals("processing");
  }
}
