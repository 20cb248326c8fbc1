/*
 * Where: pipeline service layer
 * What: posts {notificationType, executionId, message} to the chat workflow webhook
 * Why: the chat side formats and routes the message; this side only reports status
 */
package com.example.pipeline.service;

import com.example.pipeline.config.ChatNotificationProperties;
import com.fasterxml.jackson.annotation.JsonInclude;
import edu.umd.cs.findbugs.annotations.SuppressFBWarnings;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.http.MediaType;
import org.springframework.stereotype.Component;
import org.springframework.web.client.RestClient;
import org.springframework.web.client.RestClientException;

@Component
public class LogicAppChatNotifier implements ChatNotifier {

  private static final Logger logger = LoggerFactory.getLogger(LogicAppChatNotifier.class);

  @JsonInclude(JsonInclude.Include.NON_NULL)
  record ChatNotificationPayload(
      String notificationType, String executionId, String message, String resultUrl) {}

  private final RestClient chatRestClient;
  private final ChatNotificationProperties properties;

  @SuppressFBWarnings(
      value = "EI_EXPOSE_REP2",
      justification = "RestClient is a Spring-managed shared component and cannot be copied")
  public LogicAppChatNotifier(
      @Qualifier("chatRestClient") RestClient chatRestClient,
      ChatNotificationProperties properties) {
    this.chatRestClient = chatRestClient;
    this.properties = properties;
  }

  @Override
  public void notifyCancelled(String executionId) {
    send(
        new ChatNotificationPayload(
            "cancelled", executionId, "Processing was cancelled on request.", null));
  }

  @Override
  public void notifyCompleted(String executionId, String resultUrl) {
    send(
        new ChatNotificationPayload(
            "completed", executionId, "Processing completed.", resultUrl));
  }

  @Override
  public void notifyFailed(String executionId, String reason) {
    send(new ChatNotificationPayload("failed", executionId, reason, null));
  }

  private void send(ChatNotificationPayload payload) {
    if (!properties.configured()) {
      logger.info(
          "chat webhook not configured, skipping {} notification executionId={}",
          payload.notificationType(),
          payload.executionId());
      return;
    }
    try {
      chatRestClient
          .post()
          .uri(properties.webhookUrl())
          .contentType(MediaType.APPLICATION_JSON)
          .body(payload)
          .retrieve()
          .toBodilessEntity();
      logger.info(
          "chat notification sent type={} executionId={}",
          payload.notificationType(),
          payload.executionId());
    } catch (RestClientException ex) {
      throw new ChatNotificationException(
          "chat notification failed type=" + payload.notificationType(), ex);
    }
  }
}
