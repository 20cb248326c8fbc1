/*
 * Where: pipeline service layer
 * What: instance-local record of recently accepted work keys
 * Why: upstream redeliveries and queue redeliveries must not start a second job
 */
package com.example.pipeline.service;

import com.example.pipeline.config.PipelineCacheProperties;
import com.example.pipeline.model.WorkKey;
import java.time.Clock;
import org.springframework.stereotype.Component;

@Component
public class DedupCache {

  private final ExpiringKeyStore<WorkKey, Boolean> marks;

  public DedupCache(PipelineCacheProperties properties, Clock clock) {
    this.marks =
        new ExpiringKeyStore<>(properties.dedupTtl(), clock);
  }

  /**
   * Marks the key as seen. Check and mark happen in one atomic step, so of two concurrent
   * callers with the same key exactly one gets {@code true}.
   */
  public boolean tryMark(WorkKey key) {
    return marks.putIfAbsent(key, Boolean.TRUE);
  }

  public boolean isMarked(WorkKey key) {
    return marks.get(key).isPresent();
  }

  public void unmark(WorkKey key) {
    marks.remove(key);
  }

  int size() {
    return marks.size();
  }
}
