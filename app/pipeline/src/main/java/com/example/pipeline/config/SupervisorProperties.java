/*
 * Where: pipeline configuration binding
 * What: inactivity watchdog, progress tick and result-token settings of the subprocess supervisor
 * Why: an agent run may legitimately take many minutes, but silence beyond the ceiling means a hang
 */
package com.example.pipeline.config;

import java.time.Duration;
import org.springframework.boot.context.properties.ConfigurationProperties;

@ConfigurationProperties(prefix = "pipeline.supervisor")
public record SupervisorProperties(
    Duration inactivityTimeout,
    Duration watchdogInterval,
    Duration progressInterval,
    Duration readerJoinTimeout,
    String resultTokenKey,
    int previewMaxLength) {

  public SupervisorProperties {
    inactivityTimeout = inactivityTimeout == null ? Duration.ofMinutes(15) : inactivityTimeout;
    watchdogInterval = watchdogInterval == null ? Duration.ofSeconds(30) : watchdogInterval;
    progressInterval = progressInterval == null ? Duration.ofSeconds(60) : progressInterval;
    readerJoinTimeout = readerJoinTimeout == null ? Duration.ofSeconds(5) : readerJoinTimeout;
    resultTokenKey =
        resultTokenKey == null || resultTokenKey.isBlank() ? "DEPLOYED_URL" : resultTokenKey;
    previewMaxLength = previewMaxLength <= 0 ? 120 : previewMaxLength;
  }
}
