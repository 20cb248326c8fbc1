/*
 * Where: pipeline configuration binding
 * What: push-subscription renewal schedule, expiry window and retry policy
 * Why: the renewal window stays below the subscription's maximum lifetime to absorb clock drift
 */
package com.example.pipeline.config;

import java.time.Duration;
import org.springframework.boot.context.properties.ConfigurationProperties;

@ConfigurationProperties(prefix = "pipeline.subscription")
public record SubscriptionRenewalProperties(
    boolean enabled,
    String subscriptionId,
    String graphBaseUrl,
    String scope,
    Duration renewalWindow,
    int maxAttempts,
    Duration requestTimeout,
    Duration backoffBase,
    Duration backoffMax,
    Duration maxRetryAfter) {

  public SubscriptionRenewalProperties {
    graphBaseUrl =
        graphBaseUrl == null || graphBaseUrl.isBlank()
            ? "https://graph.microsoft.com/v1.0"
            : graphBaseUrl;
    scope = scope == null || scope.isBlank() ? "https://graph.microsoft.com/.default" : scope;
    renewalWindow = renewalWindow == null ? Duration.ofHours(60) : renewalWindow;
    maxAttempts = maxAttempts <= 0 ? 3 : maxAttempts;
    requestTimeout = requestTimeout == null ? Duration.ofSeconds(30) : requestTimeout;
    backoffBase = backoffBase == null ? Duration.ofSeconds(2) : backoffBase;
    backoffMax = backoffMax == null ? Duration.ofSeconds(30) : backoffMax;
    maxRetryAfter = maxRetryAfter == null ? Duration.ofMinutes(2) : maxRetryAfter;
  }
}
