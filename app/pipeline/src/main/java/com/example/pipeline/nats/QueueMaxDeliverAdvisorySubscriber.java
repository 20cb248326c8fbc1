/*
 * Where: pipeline NATS layer
 * What: consumes the JetStream MaxDeliver advisory for the transcript consumer
 * Why: a message that exhausted its redeliveries is a dead letter and must be visible
 */
package com.example.pipeline.nats;

import com.example.pipeline.config.PipelineQueueAdvisoryProperties;
import com.example.pipeline.config.PipelineQueueProperties;
import com.example.pipeline.service.PipelineMetrics;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.google.common.annotations.VisibleForTesting;
import edu.umd.cs.findbugs.annotations.SuppressFBWarnings;
import io.nats.client.Connection;
import io.nats.client.Dispatcher;
import io.nats.client.JetStream;
import io.nats.client.JetStreamApiException;
import io.nats.client.JetStreamManagement;
import io.nats.client.JetStreamSubscription;
import io.nats.client.Message;
import io.nats.client.PushSubscribeOptions;
import io.nats.client.api.AckPolicy;
import io.nats.client.api.ConsumerConfiguration;
import io.nats.client.api.StreamConfiguration;
import jakarta.annotation.PostConstruct;
import jakarta.annotation.PreDestroy;
import java.io.IOException;
import java.util.OptionalLong;
import java.util.concurrent.atomic.AtomicBoolean;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.stereotype.Component;

@Component
@ConditionalOnProperty(name = "nats.enabled", havingValue = "true", matchIfMissing = true)
public class QueueMaxDeliverAdvisorySubscriber {

  private static final Logger logger =
      LoggerFactory.getLogger(QueueMaxDeliverAdvisorySubscriber.class);
  private static final int STREAM_NOT_FOUND_ERROR = 404;
  private static final int STREAM_NOT_FOUND_API_ERROR = 10059;

  @SuppressFBWarnings(
      value = "EI_EXPOSE_REP2",
      justification = "NATS Connection is an externally managed shared resource")
  private final Connection connection;

  private final PipelineQueueProperties queueProperties;
  private final PipelineQueueAdvisoryProperties advisoryProperties;
  private final PipelineMetrics metrics;
  private final ObjectMapper objectMapper;
  private final AtomicBoolean started;
  private Dispatcher dispatcher;
  private JetStreamSubscription subscription;

  public QueueMaxDeliverAdvisorySubscriber(
      Connection connection,
      PipelineQueueProperties queueProperties,
      PipelineQueueAdvisoryProperties advisoryProperties,
      PipelineMetrics metrics,
      ObjectMapper objectMapper) {
    this.connection = connection;
    this.queueProperties = queueProperties;
    this.advisoryProperties = advisoryProperties;
    this.metrics = metrics;
    this.objectMapper = objectMapper;
    this.started = new AtomicBoolean(false);
  }

  @PostConstruct
  public void start() {
    if (!started.compareAndSet(false, true)) {
      return;
    }
    try {
      ensureStream();
      final JetStream jetStream = connection.jetStream();
      dispatcher = connection.createDispatcher();
      subscription =
          jetStream.subscribe(
              advisoryProperties.subject(),
              dispatcher,
              this::handleMessage,
              false,
              buildPushSubscribeOptions());
      logger.info(
          "dead-letter advisory subscriber started subject={} stream={} durable={}",
          advisoryProperties.subject(),
          advisoryProperties.stream(),
          advisoryProperties.durable());
    } catch (IOException | JetStreamApiException ex) {
      started.set(false);
      throw new IllegalStateException("failed to start advisory subscription", ex);
    }
  }

  @PreDestroy
  public void stop() {
    if (subscription != null) {
      subscription.unsubscribe();
      subscription = null;
    }
    if (dispatcher != null) {
      connection.closeDispatcher(dispatcher);
      dispatcher = null;
    }
  }

  @VisibleForTesting
  void handleMessage(Message message) {
    try {
      final OptionalLong streamSeq = extractStreamSeq(message);
      if (streamSeq.isEmpty()) {
        logger.warn("advisory payload missing stream_seq subject={}", advisoryProperties.subject());
      } else {
        logger.error(
            "transcript message dead-lettered stream={} stream_seq={} maxDeliver={}",
            queueProperties.stream(),
            streamSeq.getAsLong(),
            queueProperties.maxDeliver());
        metrics.recordDeadLetter();
      }
      message.ack();
    } catch (IOException ex) {
      // a broken advisory payload does not get better on redelivery
      logger.warn("failed to parse advisory payload subject={}", advisoryProperties.subject(), ex);
      message.ack();
    } catch (RuntimeException ex) {
      logger.warn("failed to handle advisory payload subject={}", advisoryProperties.subject(), ex);
      message.nak();
    }
  }

  private OptionalLong extractStreamSeq(Message message) throws IOException {
    final JsonNode payload = objectMapper.readTree(message.getData());
    final JsonNode streamSeqNode = payload == null ? null : payload.get("stream_seq");
    if (streamSeqNode == null || !streamSeqNode.canConvertToLong()) {
      return OptionalLong.empty();
    }
    final long streamSeq = streamSeqNode.asLong();
    return streamSeq <= 0L ? OptionalLong.empty() : OptionalLong.of(streamSeq);
  }

  private void ensureStream() throws IOException, JetStreamApiException {
    final StreamConfiguration streamConfiguration =
        StreamConfiguration.builder()
            .name(advisoryProperties.stream())
            .subjects(advisoryProperties.subject())
            .build();
    final JetStreamManagement jetStreamManagement = connection.jetStreamManagement();
    try {
      jetStreamManagement.updateStream(streamConfiguration);
    } catch (JetStreamApiException ex) {
      if (!isStreamNotFound(ex)) {
        throw ex;
      }
      jetStreamManagement.addStream(streamConfiguration);
    }
  }

  private boolean isStreamNotFound(JetStreamApiException ex) {
    return ex.getApiErrorCode() == STREAM_NOT_FOUND_API_ERROR
        || ex.getErrorCode() == STREAM_NOT_FOUND_ERROR;
  }

  private PushSubscribeOptions buildPushSubscribeOptions() {
    final ConsumerConfiguration consumerConfiguration =
        ConsumerConfiguration.builder()
            .ackPolicy(AckPolicy.Explicit)
            .ackWait(queueProperties.ackWait())
            .maxDeliver(queueProperties.maxDeliver())
            .build();
    return PushSubscribeOptions.builder()
        .stream(advisoryProperties.stream())
        .durable(advisoryProperties.durable())
        .configuration(consumerConfiguration)
        .build();
  }
}
