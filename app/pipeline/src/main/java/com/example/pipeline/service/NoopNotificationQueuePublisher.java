package com.example.pipeline.service;

import com.example.pipeline.model.TranscriptNotification;
import java.util.List;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.stereotype.Component;

@Component
@ConditionalOnProperty(name = "nats.enabled", havingValue = "false")
public class NoopNotificationQueuePublisher implements NotificationQueuePublisher {

  private static final Logger logger =
      LoggerFactory.getLogger(NoopNotificationQueuePublisher.class);

  @Override
  public void publishAll(List<TranscriptNotification> notifications) {
    logger.warn("nats disabled, dropping {} transcript notification(s)", notifications.size());
  }
}
