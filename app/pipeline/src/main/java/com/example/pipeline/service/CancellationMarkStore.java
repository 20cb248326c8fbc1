package com.example.pipeline.service;

import com.example.pipeline.config.PipelineCacheProperties;
import java.time.Clock;
import org.springframework.stereotype.Component;

/** Remembers which executions were asked to cancel, so the running job can poll for it. */
@Component
public class CancellationMarkStore {

  private final ExpiringKeyStore<String, Boolean> marks;

  public CancellationMarkStore(PipelineCacheProperties properties, Clock clock) {
    this.marks = new ExpiringKeyStore<>(properties.cancellationMarkTtl(), clock);
  }

  public void mark(String executionId) {
    marks.put(executionId, Boolean.TRUE);
  }

  public boolean isMarked(String executionId) {
    return marks.get(executionId).isPresent();
  }
}
