package com.example.pipeline.config;

import java.time.Duration;
import org.springframework.boot.context.properties.ConfigurationProperties;

@ConfigurationProperties(prefix = "pipeline.chat")
public record ChatNotificationProperties(String webhookUrl, Duration requestTimeout) {

  public ChatNotificationProperties {
    requestTimeout = requestTimeout == null ? Duration.ofSeconds(10) : requestTimeout;
  }

  public boolean configured() {
    return webhookUrl != null && !webhookUrl.isBlank();
  }
}
