/*
 * Where: pipeline API
 * What: push-notification endpoint (validation handshake + notification batches)
 * Why: the handshake must be echoed verbatim, batches are only validated and enqueued
 */
package com.example.pipeline.api;

import com.example.pipeline.ingest.WebhookIngestResult;
import com.example.pipeline.ingest.WebhookIngestService;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import lombok.RequiredArgsConstructor;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.http.HttpStatus;
import org.springframework.http.MediaType;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestMethod;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;

@RestController
@RequiredArgsConstructor
public class WebhookController {

  private static final Logger logger = LoggerFactory.getLogger(WebhookController.class);

  private final WebhookIngestService ingestService;
  private final ObjectMapper objectMapper;

  @RequestMapping(
      value = "/api/webhook/transcripts",
      method = {RequestMethod.GET, RequestMethod.POST})
  public ResponseEntity<?> handle(
      @RequestParam(name = "validationToken", required = false) String validationToken,
      @RequestBody(required = false) String body) {
    if (validationToken != null) {
      logger.info("subscription validation handshake received");
      return ResponseEntity.ok().contentType(MediaType.TEXT_PLAIN).body(validationToken);
    }
    final WebhookIngestResult result = ingestService.ingest(parse(body));
    return ResponseEntity.status(HttpStatus.ACCEPTED)
        .body(new WebhookIngestResponse(result.accepted(), result.rejected()));
  }

  private JsonNode parse(String body) {
    if (body == null || body.isBlank()) {
      return null;
    }
    try {
      return objectMapper.readTree(body);
    } catch (JsonProcessingException ex) {
      throw new InvalidWebhookPayloadException("webhook body is not valid JSON", ex);
    }
  }
}
