/*
 * Where: pipeline service layer
 * What: executionId -> platform execution mapping with a TTL
 * Why: cancel requests arrive with the pipeline id, the platform only knows its own name
 */
package com.example.pipeline.service;

import com.example.pipeline.config.PipelineCacheProperties;
import com.example.pipeline.model.ExecutionRecord;
import java.time.Clock;
import java.util.Optional;
import org.springframework.stereotype.Component;

@Component
public class ExecutionTracker {

  private final ExpiringKeyStore<String, ExecutionRecord> records;

  public ExecutionTracker(PipelineCacheProperties properties, Clock clock) {
    this.records =
        new ExpiringKeyStore<>(properties.executionTtl(), clock);
  }

  public void track(ExecutionRecord record) {
    records.put(record.executionId(), record);
  }

  public Optional<ExecutionRecord> find(String executionId) {
    return records.get(executionId);
  }

  public Optional<ExecutionRecord> remove(String executionId) {
    return records.remove(executionId);
  }

  public int size() {
    return records.size();
  }
}
