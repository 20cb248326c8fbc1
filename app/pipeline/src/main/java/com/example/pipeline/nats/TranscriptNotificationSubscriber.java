/*
 * Where: pipeline NATS layer
 * What: durable explicit-ack consumer of transcript notifications
 * Why: ack on handled (dispatched or duplicate), nak on anything else so JetStream redelivers
 */
package com.example.pipeline.nats;

import com.example.common.TraceIds;
import com.example.pipeline.config.PipelineQueueProperties;
import com.example.pipeline.service.MalformedQueueMessageException;
import com.example.pipeline.service.TranscriptQueueConsumer;
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
import java.util.concurrent.atomic.AtomicBoolean;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.slf4j.MDC;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.stereotype.Component;

@Component
@ConditionalOnProperty(name = "nats.enabled", havingValue = "true", matchIfMissing = true)
public class TranscriptNotificationSubscriber {

  private static final Logger logger =
      LoggerFactory.getLogger(TranscriptNotificationSubscriber.class);
  private static final int STREAM_NOT_FOUND_ERROR = 404;
  private static final int STREAM_NOT_FOUND_API_ERROR = 10059;

  @SuppressFBWarnings(
      value = "EI_EXPOSE_REP2",
      justification = "NATS Connection is an externally managed shared resource")
  private final Connection connection;

  private final TranscriptQueueConsumer consumer;
  private final PipelineQueueProperties properties;
  private final AtomicBoolean started;
  private Dispatcher dispatcher;
  private JetStreamSubscription subscription;

  public TranscriptNotificationSubscriber(
      Connection connection, TranscriptQueueConsumer consumer, PipelineQueueProperties properties) {
    this.connection = connection;
    this.consumer = consumer;
    this.properties = properties;
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
              properties.subject(),
              dispatcher,
              this::handleMessage,
              false,
              buildPushSubscribeOptions());
      logger.info(
          "transcript subscriber started subject={} stream={} durable={}",
          properties.subject(),
          properties.stream(),
          properties.durable());
    } catch (IOException | JetStreamApiException ex) {
      started.set(false);
      throw new IllegalStateException("failed to start transcript subscription", ex);
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
    MDC.put(TraceIds.MDC_TRACE_ID, traceIdOf(message));
    try {
      consumer.onMessage(message.getData());
      message.ack();
    } catch (MalformedQueueMessageException ex) {
      // redelivered until max-deliver, then surfaced by the advisory subscriber
      logger.warn("malformed transcript message", ex);
      nakSilently(message);
    } catch (RuntimeException ex) {
      logger.warn("failed to handle transcript message", ex);
      nakSilently(message);
    } finally {
      MDC.remove(TraceIds.MDC_TRACE_ID);
    }
  }

  private String traceIdOf(Message message) {
    if (message.hasHeaders()) {
      final String traceId =
          message.getHeaders().getFirst(NatsNotificationQueuePublisher.HEADER_TRACE_ID);
      if (traceId != null && !traceId.isBlank()) {
        return traceId;
      }
    }
    return TraceIds.newTraceId();
  }

  private void ensureStream() throws IOException, JetStreamApiException {
    final StreamConfiguration streamConfiguration =
        StreamConfiguration.builder()
            .name(properties.stream())
            .subjects(properties.subject())
            .duplicateWindow(properties.duplicateWindow())
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
    logger.info(
        "transcript stream ensured stream={} subject={} duplicateWindow={}",
        properties.stream(),
        properties.subject(),
        properties.duplicateWindow());
  }

  private boolean isStreamNotFound(JetStreamApiException ex) {
    return ex.getApiErrorCode() == STREAM_NOT_FOUND_API_ERROR
        || ex.getErrorCode() == STREAM_NOT_FOUND_ERROR;
  }

  private PushSubscribeOptions buildPushSubscribeOptions() {
    final ConsumerConfiguration consumerConfiguration =
        ConsumerConfiguration.builder()
            .ackPolicy(AckPolicy.Explicit)
            .ackWait(properties.ackWait())
            .maxDeliver(properties.maxDeliver())
            .build();
    return PushSubscribeOptions.builder()
        .stream(properties.stream())
        .durable(properties.durable())
        .configuration(consumerConfiguration)
        .build();
  }

  private void nakSilently(Message message) {
    try {
      message.nak();
    } catch (IllegalStateException ex) {
      logger.warn("failed to nak transcript message", ex);
    }
  }
}
