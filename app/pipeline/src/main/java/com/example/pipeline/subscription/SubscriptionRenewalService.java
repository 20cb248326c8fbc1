/*
 * Where: pipeline subscription renewal
 * What: acquires a token and pushes the subscription expiry forward, both with retries
 * Why: a lapsed subscription silently stops all notifications, so every outcome is logged
 */
package com.example.pipeline.subscription;

import com.example.pipeline.config.SubscriptionRenewalProperties;
import com.example.pipeline.platform.AccessTokenClient;
import com.example.pipeline.service.PipelineMetrics;
import java.time.Clock;
import java.time.Instant;
import java.util.List;
import lombok.RequiredArgsConstructor;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

@Service
@RequiredArgsConstructor
public class SubscriptionRenewalService {

  private static final Logger logger = LoggerFactory.getLogger(SubscriptionRenewalService.class);

  private final SubscriptionRenewalProperties properties;
  private final AccessTokenClient accessTokenClient;
  private final GraphSubscriptionClient subscriptionClient;
  private final RenewalRetryExecutor retryExecutor;
  private final PipelineMetrics metrics;
  private final Clock clock;

  /** Never throws. */
  public RenewalResult renew() {
    final RenewalResult result;
    try {
      result = doRenew();
    } catch (RuntimeException ex) {
      logger.error("subscription renewal failed unexpectedly", ex);
      metrics.recordRenewal(RenewalResult.RENEWAL_FAILED.name());
      return RenewalResult.RENEWAL_FAILED;
    }
    metrics.recordRenewal(result.name());
    return result;
  }

  private RenewalResult doRenew() {
    final String subscriptionId = properties.subscriptionId();
    if (subscriptionId == null || subscriptionId.isBlank()) {
      logger.info("no subscription id configured, renewal skipped");
      return RenewalResult.SKIPPED_NOT_CONFIGURED;
    }
    final List<String> missing = accessTokenClient.missingCredentials();
    if (!missing.isEmpty()) {
      logger.error(
          "subscription renewal skipped, missing credentials: {}", String.join(", ", missing));
      return RenewalResult.SKIPPED_MISSING_CREDENTIALS;
    }

    final RetryOutcome<String> token =
        retryExecutor.execute(
            "token acquisition", () -> accessTokenClient.acquire(properties.scope()));
    if (!token.succeeded()) {
      logger.error(
          "subscription renewal aborted, token acquisition {} attempts={} duration={}ms",
          token.status(),
          token.attempts(),
          token.elapsed().toMillis(),
          token.lastError());
      return RenewalResult.TOKEN_FAILED;
    }

    final Instant newExpiry = clock.instant().plus(properties.renewalWindow());
    final RetryOutcome<Boolean> renewal =
        retryExecutor.execute(
            "subscription renewal",
            () -> {
              subscriptionClient.renew(subscriptionId, newExpiry, token.value());
              return Boolean.TRUE;
            });
    if (!renewal.succeeded()) {
      logger.error(
          "subscription renewal {} subscriptionId={} attempts={} duration={}ms",
          renewal.status(),
          subscriptionId,
          renewal.attempts(),
          renewal.elapsed().toMillis(),
          renewal.lastError());
      return RenewalResult.RENEWAL_FAILED;
    }
    logger.info(
        "subscription renewed subscriptionId={} newExpiry={} attempts={} duration={}ms",
        subscriptionId,
        newExpiry,
        renewal.attempts(),
        renewal.elapsed().toMillis());
    return RenewalResult.RENEWED;
  }
}
