/*
 * Where: pipeline service layer
 * What: handles one queue message: parse, dedup, dispatch
 * Why: a failed dispatch must release the dedup mark so the redelivery can try again
 */
package com.example.pipeline.service;

import com.example.pipeline.model.TranscriptNotification;
import com.example.pipeline.model.WorkKey;
import com.fasterxml.jackson.databind.ObjectMapper;
import java.io.IOException;
import lombok.RequiredArgsConstructor;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.slf4j.MDC;
import org.springframework.stereotype.Service;

@Service
@RequiredArgsConstructor
public class TranscriptQueueConsumer {

  private static final Logger logger = LoggerFactory.getLogger(TranscriptQueueConsumer.class);

  public enum Outcome {
    DISPATCHED,
    DUPLICATE
  }

  private final ObjectMapper objectMapper;
  private final DedupCache dedupCache;
  private final JobDispatcher jobDispatcher;
  private final PipelineMetrics metrics;

  /**
   * Returns normally when the message is done (dispatched or a duplicate); throws when it
   * should be redelivered.
   */
  public Outcome onMessage(byte[] payload) {
    final TranscriptNotification notification = parse(payload);
    final WorkKey key = notification.workKey();
    MDC.put("work_key", key.value());
    try {
      if (!dedupCache.tryMark(key)) {
        logger.info("duplicate transcript notification skipped workKey={}", key);
        metrics.recordQueueMessage("duplicate");
        return Outcome.DUPLICATE;
      }
      try {
        jobDispatcher.dispatch(notification);
      } catch (RuntimeException ex) {
        dedupCache.unmark(key);
        metrics.recordQueueMessage("failed");
        logger.warn("dispatch failed, released dedup mark workKey={}", key, ex);
        throw ex;
      }
      metrics.recordQueueMessage("dispatched");
      return Outcome.DISPATCHED;
    } finally {
      MDC.remove("work_key");
    }
  }

  private TranscriptNotification parse(byte[] payload) {
    final TranscriptNotification notification;
    try {
      notification = objectMapper.readValue(payload, TranscriptNotification.class);
    } catch (IOException ex) {
      throw new MalformedQueueMessageException("queue message is not a transcript notification", ex);
    }
    if (notification == null || !notification.isComplete()) {
      throw new MalformedQueueMessageException("queue message is missing identifiers");
    }
    return notification;
  }
}
