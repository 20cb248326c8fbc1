/*
 * Where: pipeline ingest layer
 * What: validates a batch of change notifications and enqueues the valid ones
 * Why: invalid entries are dropped per entry so the sender never retries them
 */
package com.example.pipeline.ingest;

import com.example.pipeline.config.WebhookProperties;
import com.example.pipeline.model.TranscriptNotification;
import com.example.pipeline.service.NotificationQueuePublisher;
import com.example.pipeline.service.PipelineMetrics;
import com.fasterxml.jackson.databind.JsonNode;
import java.time.Clock;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import java.util.Optional;
import lombok.RequiredArgsConstructor;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

@Service
@RequiredArgsConstructor
public class WebhookIngestService {

  private static final Logger logger = LoggerFactory.getLogger(WebhookIngestService.class);

  private final WebhookProperties properties;
  private final NotificationQueuePublisher publisher;
  private final PipelineMetrics metrics;
  private final Clock clock;

  /**
   * Validates each entry of {@code body.value} and publishes the accepted ones in one call.
   *
   * @throws com.example.pipeline.service.QueuePublishException when the queue write fails
   */
  public WebhookIngestResult ingest(JsonNode body) {
    final JsonNode entries = body == null ? null : body.get("value");
    if (entries == null || !entries.isArray()) {
      logger.info("webhook body has no value array");
      return new WebhookIngestResult(0, 0);
    }
    final Instant receivedAt = clock.instant();
    final List<TranscriptNotification> batch = new ArrayList<>();
    int rejected = 0;
    for (JsonNode entry : entries) {
      final Optional<TranscriptNotification> notification = toNotification(entry, receivedAt);
      if (notification.isPresent()) {
        batch.add(notification.get());
      } else {
        rejected++;
      }
    }
    if (!batch.isEmpty()) {
      publisher.publishAll(batch);
    }
    metrics.recordWebhookEntries(batch.size(), rejected);
    logger.info("webhook batch handled accepted={} rejected={}", batch.size(), rejected);
    return new WebhookIngestResult(batch.size(), rejected);
  }

  private Optional<TranscriptNotification> toNotification(JsonNode entry, Instant receivedAt) {
    if (!properties.clientState().equals(text(entry, "clientState"))) {
      logger.warn("webhook entry rejected: client state mismatch");
      return Optional.empty();
    }
    final JsonNode resourceData = entry.path("resourceData");
    final String resourceType = text(resourceData, "@odata.type");
    if (resourceType == null
        || !resourceType
            .toLowerCase(Locale.ROOT)
            .contains(properties.resourceType().toLowerCase(Locale.ROOT))) {
      logger.info("webhook entry rejected: resource type {}", resourceType);
      return Optional.empty();
    }
    final String resource = text(entry, "resource");
    final String userId =
        TranscriptResourcePath.userId(resource)
            .orElseGet(() -> text(resourceData, "meetingOrganizerId"));
    final String meetingId =
        TranscriptResourcePath.meetingId(resource)
            .orElseGet(() -> text(resourceData, "meetingId"));
    final String transcriptId =
        TranscriptResourcePath.transcriptId(resource).orElseGet(() -> text(resourceData, "id"));
    final TranscriptNotification notification =
        new TranscriptNotification(userId, meetingId, transcriptId, receivedAt);
    if (!notification.isComplete()) {
      logger.warn(
          "webhook entry rejected: missing ids userId={} meetingId={} transcriptId={}",
          userId,
          meetingId,
          transcriptId);
      return Optional.empty();
    }
    return Optional.of(notification);
  }

  private String text(JsonNode node, String field) {
    if (node == null) {
      return null;
    }
    final JsonNode value = node.get(field);
    return value == null || !value.isTextual() ? null : value.asText();
  }
}
