/*
 * Where: pipeline NATS subscriber test
 * What: checks ack/nak per consumer outcome and the stream/consumer setup on start
 * Why: a wrong ack loses work, a wrong nak loops it until dead-letter
 */
package com.example.pipeline.nats;

import static org.junit.jupiter.api.Assertions.assertDoesNotThrow;
import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertNull;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.doReturn;
import static org.mockito.Mockito.doThrow;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.times;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

import com.example.common.TraceIds;
import com.example.pipeline.config.PipelineQueueProperties;
import com.example.pipeline.platform.JobPlatformException;
import com.example.pipeline.service.MalformedQueueMessageException;
import com.example.pipeline.service.TranscriptQueueConsumer;
import io.nats.client.Connection;
import io.nats.client.Dispatcher;
import io.nats.client.JetStream;
import io.nats.client.JetStreamApiException;
import io.nats.client.JetStreamManagement;
import io.nats.client.JetStreamSubscription;
import io.nats.client.Message;
import io.nats.client.MessageHandler;
import io.nats.client.PushSubscribeOptions;
import io.nats.client.api.AckPolicy;
import io.nats.client.api.Error;
import io.nats.client.api.StreamConfiguration;
import io.nats.client.impl.Headers;
import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.time.Duration;
import java.util.concurrent.atomic.AtomicReference;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.ArgumentCaptor;
import org.mockito.Captor;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import org.slf4j.MDC;

@ExtendWith(MockitoExtension.class)
class TranscriptNotificationSubscriberTest {

  private static final String SUBJECT = "transcript.notifications";
  private static final String STREAM = "TRANSCRIPT_NOTIFICATIONS";
  private static final String DURABLE = "pipeline-transcript-consumer";
  private static final Duration DUPLICATE_WINDOW = Duration.ofMinutes(2);
  private static final Duration ACK_WAIT = Duration.ofMinutes(2);
  private static final int MAX_DELIVER = 5;
  private static final byte[] PAYLOAD =
      "{\"user_id\":\"u1\",\"meeting_id\":\"m1\",\"transcript_id\":\"t1\"}"
          .getBytes(StandardCharsets.UTF_8);

  @Mock private Connection connection;
  @Mock private JetStream jetStream;
  @Mock private JetStreamManagement jetStreamManagement;
  @Mock private Dispatcher dispatcher;
  @Mock private JetStreamSubscription subscription;
  @Mock private TranscriptQueueConsumer consumer;
  @Captor private ArgumentCaptor<MessageHandler> handlerCaptor;
  @Captor private ArgumentCaptor<PushSubscribeOptions> optionsCaptor;
  @Captor private ArgumentCaptor<StreamConfiguration> streamCaptor;

  private TranscriptNotificationSubscriber subscriber;

  @BeforeEach
  void setUp() {
    final PipelineQueueProperties properties =
        new PipelineQueueProperties(
            SUBJECT, STREAM, DURABLE, DUPLICATE_WINDOW, ACK_WAIT, MAX_DELIVER);
    subscriber = new TranscriptNotificationSubscriber(connection, consumer, properties);
  }

  @Test
  void ackWhenDispatched() throws IOException, InterruptedException, JetStreamApiException {
    final Message message = mock(Message.class);
    startCapturingHandler();
    when(message.getData()).thenReturn(PAYLOAD);
    when(consumer.onMessage(PAYLOAD)).thenReturn(TranscriptQueueConsumer.Outcome.DISPATCHED);

    handlerCaptor.getValue().onMessage(message);

    verify(message).ack();
    verify(message, never()).nak();
  }

  @Test
  void ackWhenDuplicate() throws IOException, InterruptedException, JetStreamApiException {
    final Message message = mock(Message.class);
    startCapturingHandler();
    when(message.getData()).thenReturn(PAYLOAD);
    when(consumer.onMessage(PAYLOAD)).thenReturn(TranscriptQueueConsumer.Outcome.DUPLICATE);

    handlerCaptor.getValue().onMessage(message);

    verify(message).ack();
  }

  @Test
  void nakWhenDispatchFails() throws IOException, InterruptedException, JetStreamApiException {
    final Message message = mock(Message.class);
    startCapturingHandler();
    when(message.getData()).thenReturn(PAYLOAD);
    doThrow(new JobPlatformException(JobPlatformException.Reason.TIMEOUT, "timeout"))
        .when(consumer)
        .onMessage(PAYLOAD);

    handlerCaptor.getValue().onMessage(message);

    verify(message).nak();
    verify(message, never()).ack();
    verify(message, never()).term();
  }

  @Test
  void nakWhenPayloadMalformed() throws IOException, InterruptedException, JetStreamApiException {
    final Message message = mock(Message.class);
    startCapturingHandler();
    when(message.getData()).thenReturn(new byte[] {(byte) 0x80});
    doThrow(new MalformedQueueMessageException("bad payload"))
        .when(consumer)
        .onMessage(any(byte[].class));

    handlerCaptor.getValue().onMessage(message);

    verify(message).nak();
    verify(message, never()).ack();
  }

  @Test
  void traceIdHeaderIsVisibleWhileHandling() {
    final Message message = mock(Message.class);
    final Headers headers = new Headers();
    headers.add(NatsNotificationQueuePublisher.HEADER_TRACE_ID, "trace-123");
    when(message.hasHeaders()).thenReturn(true);
    when(message.getHeaders()).thenReturn(headers);
    when(message.getData()).thenReturn(PAYLOAD);
    final AtomicReference<String> seen = new AtomicReference<>();
    when(consumer.onMessage(PAYLOAD))
        .thenAnswer(
            invocation -> {
              seen.set(MDC.get(TraceIds.MDC_TRACE_ID));
              return TranscriptQueueConsumer.Outcome.DISPATCHED;
            });

    subscriber.handleMessage(message);

    assertEquals("trace-123", seen.get());
    assertNull(MDC.get(TraceIds.MDC_TRACE_ID));
  }

  @Test
  void startCreatesMissingStreamWithDuplicateWindow() throws IOException, JetStreamApiException {
    stubConnection();
    doReturn(subscription)
        .when(jetStream)
        .subscribe(
            eq(SUBJECT),
            eq(dispatcher),
            any(MessageHandler.class),
            eq(false),
            any(PushSubscribeOptions.class));
    doThrow(new StreamNotFoundException())
        .when(jetStreamManagement)
        .updateStream(any(StreamConfiguration.class));

    subscriber.start();

    verify(jetStreamManagement).addStream(streamCaptor.capture());
    assertEquals(STREAM, streamCaptor.getValue().getName());
    assertEquals(DUPLICATE_WINDOW, streamCaptor.getValue().getDuplicateWindow());
  }

  @Test
  void startUsesExplicitAckWithAckWaitAndMaxDeliver() throws IOException, JetStreamApiException {
    stubConnection();
    doReturn(subscription)
        .when(jetStream)
        .subscribe(
            eq(SUBJECT),
            eq(dispatcher),
            any(MessageHandler.class),
            eq(false),
            optionsCaptor.capture());

    subscriber.start();

    final PushSubscribeOptions options = optionsCaptor.getValue();
    assertEquals(DURABLE, options.getDurable());
    assertEquals(AckPolicy.Explicit, options.getConsumerConfiguration().getAckPolicy());
    assertEquals(ACK_WAIT, options.getConsumerConfiguration().getAckWait());
    assertEquals(MAX_DELIVER, options.getConsumerConfiguration().getMaxDeliver());
  }

  @Test
  void stopIsSafeWhenCalledTwice() throws IOException, JetStreamApiException {
    stubConnection();
    doReturn(subscription)
        .when(jetStream)
        .subscribe(
            eq(SUBJECT),
            eq(dispatcher),
            any(MessageHandler.class),
            eq(false),
            any(PushSubscribeOptions.class));

    subscriber.start();

    assertDoesNotThrow(subscriber::stop);
    assertDoesNotThrow(subscriber::stop);
    verify(subscription, times(1)).unsubscribe();
    verify(connection, times(1)).closeDispatcher(dispatcher);
  }

  private void startCapturingHandler() throws IOException, JetStreamApiException {
    stubConnection();
    doReturn(subscription)
        .when(jetStream)
        .subscribe(
            eq(SUBJECT),
            eq(dispatcher),
            handlerCaptor.capture(),
            eq(false),
            any(PushSubscribeOptions.class));
    subscriber.start();
  }

  private void stubConnection() throws IOException {
    doReturn(jetStream).when(connection).jetStream();
    doReturn(jetStreamManagement).when(connection).jetStreamManagement();
    when(connection.createDispatcher()).thenReturn(dispatcher);
  }

  private static final class StreamNotFoundException extends JetStreamApiException {
    private StreamNotFoundException() {
      super(Error.JsBadRequestErr);
    }

    @Override
    public int getApiErrorCode() {
      return 10059;
    }

    @Override
    public int getErrorCode() {
      return 404;
    }
  }
}
