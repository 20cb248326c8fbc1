package com.example.pipeline.ingest;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.ArgumentMatchers.anyList;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;

import com.example.pipeline.config.WebhookProperties;
import com.example.pipeline.model.TranscriptNotification;
import com.example.pipeline.service.NotificationQueuePublisher;
import com.example.pipeline.service.PipelineMetrics;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import java.time.Clock;
import java.time.Instant;
import java.time.ZoneOffset;
import java.util.List;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.ArgumentCaptor;
import org.mockito.Captor;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

@ExtendWith(MockitoExtension.class)
class WebhookIngestServiceTest {

  private static final Instant NOW = Instant.parse("2026-03-01T09:00:00Z");

  @Mock private NotificationQueuePublisher publisher;
  @Captor private ArgumentCaptor<List<TranscriptNotification>> batchCaptor;

  private final ObjectMapper objectMapper = new ObjectMapper();
  private WebhookIngestService service;

  @BeforeEach
  void setUp() {
    service =
        new WebhookIngestService(
            new WebhookProperties("secret-state", "callTranscript"),
            publisher,
            new PipelineMetrics(new SimpleMeterRegistry()),
            Clock.fixed(NOW, ZoneOffset.UTC));
  }

  @Test
  void acceptsValidEntryFromResourcePath() throws Exception {
    final WebhookIngestResult result =
        service.ingest(
            body(
                """
                {"value":[{
                  "clientState":"secret-state",
                  "resource":"users('u1')/onlineMeetings('m1')/transcripts('t1')",
                  "resourceData":{"@odata.type":"#Microsoft.Graph.callTranscript"}
                }]}
                """));

    assertThat(result).isEqualTo(new WebhookIngestResult(1, 0));
    verify(publisher).publishAll(batchCaptor.capture());
    assertThat(batchCaptor.getValue())
        .containsExactly(new TranscriptNotification("u1", "m1", "t1", NOW));
  }

  @Test
  void fallsBackToResourceDataIdentifiers() throws Exception {
    service.ingest(
        body(
            """
            {"value":[{
              "clientState":"secret-state",
              "resource":"communications/onlineMeetings/getAllTranscripts",
              "resourceData":{
                "@odata.type":"#microsoft.graph.CALLTRANSCRIPT",
                "meetingOrganizerId":"u9",
                "meetingId":"m9",
                "id":"t9"
              }
            }]}
            """));

    verify(publisher).publishAll(batchCaptor.capture());
    assertThat(batchCaptor.getValue())
        .containsExactly(new TranscriptNotification("u9", "m9", "t9", NOW));
  }

  @Test
  void rejectsEntriesIndividually() throws Exception {
    final WebhookIngestResult result =
        service.ingest(
            body(
                """
                {"value":[
                  {"clientState":"wrong",
                   "resource":"users('u1')/onlineMeetings('m1')/transcripts('t1')",
                   "resourceData":{"@odata.type":"#microsoft.graph.callTranscript"}},
                  {"clientState":"secret-state",
                   "resource":"users('u1')/onlineMeetings('m1')/recordings('r1')",
                   "resourceData":{"@odata.type":"#microsoft.graph.callRecording"}},
                  {"clientState":"secret-state",
                   "resource":"users('u1')/onlineMeetings('m1')",
                   "resourceData":{"@odata.type":"#microsoft.graph.callTranscript"}},
                  {"clientState":"secret-state",
                   "resource":"users('u2')/onlineMeetings('m2')/transcripts('t2')",
                   "resourceData":{"@odata.type":"#microsoft.graph.callTranscript"}}
                ]}
                """));

    assertThat(result).isEqualTo(new WebhookIngestResult(1, 3));
    verify(publisher).publishAll(batchCaptor.capture());
    assertThat(batchCaptor.getValue()).extracting(TranscriptNotification::transcriptId)
        .containsExactly("t2");
  }

  @Test
  void missingClientStateIsRejected() throws Exception {
    final WebhookIngestResult result =
        service.ingest(
            body(
                """
                {"value":[{
                  "resource":"users('u1')/onlineMeetings('m1')/transcripts('t1')",
                  "resourceData":{"@odata.type":"#microsoft.graph.callTranscript"}
                }]}
                """));

    assertThat(result).isEqualTo(new WebhookIngestResult(0, 1));
    verify(publisher, never()).publishAll(anyList());
  }

  @Test
  void bodyWithoutValueArrayIsEmptyResult() throws Exception {
    assertThat(service.ingest(body("{}"))).isEqualTo(new WebhookIngestResult(0, 0));
    assertThat(service.ingest(null)).isEqualTo(new WebhookIngestResult(0, 0));
    verify(publisher, never()).publishAll(anyList());
  }

  private JsonNode body(String json) throws Exception {
    return objectMapper.readTree(json);
  }
}
