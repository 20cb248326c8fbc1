package com.example.pipeline.service;

import com.example.pipeline.model.TranscriptNotification;
import java.util.List;

/** Writes accepted notifications to the durable queue. */
public interface NotificationQueuePublisher {

  /**
   * Publishes the whole batch in one call.
   *
   * @throws QueuePublishException when the queue rejects or cannot be reached
   */
  void publishAll(List<TranscriptNotification> notifications);
}
