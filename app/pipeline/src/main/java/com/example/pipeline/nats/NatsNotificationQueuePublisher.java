/*
 * Where: pipeline NATS layer
 * What: publishes each accepted notification as one JetStream message
 * Why: each message is acked and redelivered independently by the consumer
 */
package com.example.pipeline.nats;

import com.example.common.TraceIds;
import com.example.pipeline.config.PipelineQueueProperties;
import com.example.pipeline.model.TranscriptNotification;
import com.example.pipeline.service.NotificationQueuePublisher;
import com.example.pipeline.service.QueuePublishException;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import edu.umd.cs.findbugs.annotations.SuppressFBWarnings;
import io.nats.client.JetStream;
import io.nats.client.JetStreamApiException;
import io.nats.client.impl.Headers;
import java.io.IOException;
import java.util.List;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.stereotype.Component;

@Component
@ConditionalOnProperty(name = "nats.enabled", havingValue = "true", matchIfMissing = true)
public class NatsNotificationQueuePublisher implements NotificationQueuePublisher {

  private static final Logger logger =
      LoggerFactory.getLogger(NatsNotificationQueuePublisher.class);
  static final String HEADER_TRACE_ID = "trace_id";

  @SuppressFBWarnings(
      value = "EI_EXPOSE_REP2",
      justification = "JetStream context is owned by the shared NATS connection")
  private final JetStream jetStream;

  private final PipelineQueueProperties properties;
  private final ObjectMapper objectMapper;

  public NatsNotificationQueuePublisher(
      JetStream jetStream, PipelineQueueProperties properties, ObjectMapper objectMapper) {
    this.jetStream = jetStream;
    this.properties = properties;
    this.objectMapper = objectMapper;
  }

  @Override
  public void publishAll(List<TranscriptNotification> notifications) {
    final String traceId = TraceIds.currentOrNew();
    for (TranscriptNotification notification : notifications) {
      final Headers headers = new Headers();
      // the stream's duplicate window drops upstream resends of the same work key
      headers.add("Nats-Msg-Id", notification.workKey().value());
      headers.add(HEADER_TRACE_ID, traceId);
      try {
        jetStream.publish(
            properties.subject(), headers, objectMapper.writeValueAsBytes(notification));
      } catch (JsonProcessingException ex) {
        throw new QueuePublishException("failed to serialize transcript notification", ex);
      } catch (IOException | JetStreamApiException ex) {
        logger.warn(
            "queue publish failed subject={} workKey={}",
            properties.subject(),
            notification.workKey(),
            ex);
        throw new QueuePublishException("failed to publish transcript notification", ex);
      }
    }
    logger.debug("published {} notification(s) subject={}", notifications.size(),
        properties.subject());
  }
}
