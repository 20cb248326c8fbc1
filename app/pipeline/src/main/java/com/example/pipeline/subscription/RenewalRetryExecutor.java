/*
 * Where: pipeline subscription renewal
 * What: bounded retry of one HTTP call with Retry-After support and capped, jittered backoff
 * Why: 429/5xx and transport failures are transient, any other HTTP error is final
 */
package com.example.pipeline.subscription;

import com.example.pipeline.config.SubscriptionRenewalProperties;
import com.google.common.annotations.VisibleForTesting;
import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.Optional;
import java.util.concurrent.ThreadLocalRandom;
import java.util.function.Supplier;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.http.HttpHeaders;
import org.springframework.stereotype.Component;
import org.springframework.web.client.ResourceAccessException;
import org.springframework.web.client.RestClientResponseException;

@Component
public class RenewalRetryExecutor {

  private static final Logger logger = LoggerFactory.getLogger(RenewalRetryExecutor.class);

  private final SubscriptionRenewalProperties properties;
  private final RetrySleeper sleeper;
  private final Clock clock;

  public RenewalRetryExecutor(
      SubscriptionRenewalProperties properties, RetrySleeper sleeper, Clock clock) {
    this.properties = properties;
    this.sleeper = sleeper;
    this.clock = clock;
  }

  public <T> RetryOutcome<T> execute(String operation, Supplier<T> call) {
    final Instant startedAt = clock.instant();
    final int maxAttempts = properties.maxAttempts();
    Exception lastError = null;
    for (int attempt = 1; attempt <= maxAttempts; attempt++) {
      Duration delay;
      try {
        final T value = call.get();
        return new RetryOutcome<>(
            RetryOutcome.Status.SUCCEEDED, value, attempt, elapsedSince(startedAt), null);
      } catch (RestClientResponseException ex) {
        lastError = ex;
        final int status = ex.getStatusCode().value();
        if (!isRetryableStatus(status)) {
          logger.warn(
              "{} failed with non-retryable status={} attempt={}/{}",
              operation,
              status,
              attempt,
              maxAttempts);
          return new RetryOutcome<>(
              RetryOutcome.Status.NON_RETRYABLE, null, attempt, elapsedSince(startedAt), ex);
        }
        final int failedAttempt = attempt;
        delay = retryAfter(ex).orElseGet(() -> backoff(failedAttempt));
        logger.warn(
            "{} failed with status={} attempt={}/{}", operation, status, attempt, maxAttempts);
      } catch (ResourceAccessException ex) {
        lastError = ex;
        delay = backoff(attempt);
        logger.warn(
            "{} transport failure attempt={}/{}: {}",
            operation,
            attempt,
            maxAttempts,
            ex.getMessage());
      } catch (RuntimeException ex) {
        logger.warn("{} failed with unexpected error attempt={}", operation, attempt, ex);
        return new RetryOutcome<>(
            RetryOutcome.Status.NON_RETRYABLE, null, attempt, elapsedSince(startedAt), ex);
      }
      if (attempt == maxAttempts) {
        break;
      }
      try {
        sleeper.sleep(delay);
      } catch (InterruptedException ex) {
        Thread.currentThread().interrupt();
        return new RetryOutcome<>(
            RetryOutcome.Status.INTERRUPTED, null, attempt, elapsedSince(startedAt), ex);
      }
    }
    return new RetryOutcome<>(
        RetryOutcome.Status.RETRIES_EXHAUSTED,
        null,
        maxAttempts,
        elapsedSince(startedAt),
        lastError);
  }

  /** {@code min(cap, base * 2^(n-1) + jitter)}, jitter in {@code [0, base)}. */
  @VisibleForTesting
  Duration backoff(int attempt) {
    final long baseMillis = Math.max(properties.backoffBase().toMillis(), 1L);
    final long capMillis = properties.backoffMax().toMillis();
    final int exponent = Math.min(Math.max(attempt - 1, 0), 30);
    final long exponential = baseMillis * (1L << exponent);
    final long jitter = ThreadLocalRandom.current().nextLong(baseMillis);
    return Duration.ofMillis(Math.min(capMillis, exponential + jitter));
  }

  private Optional<Duration> retryAfter(RestClientResponseException ex) {
    final HttpHeaders headers = ex.getResponseHeaders();
    if (headers == null) {
      return Optional.empty();
    }
    final String value = headers.getFirst(HttpHeaders.RETRY_AFTER);
    if (value == null || value.isBlank()) {
      return Optional.empty();
    }
    try {
      final long seconds = Long.parseLong(value.trim());
      if (seconds < 0) {
        return Optional.empty();
      }
      final Duration hinted = Duration.ofSeconds(seconds);
      return Optional.of(
          hinted.compareTo(properties.maxRetryAfter()) > 0 ? properties.maxRetryAfter() : hinted);
    } catch (NumberFormatException ignored) {
      // HTTP-date form is not used by the subscription API; fall back to backoff
      return Optional.empty();
    }
  }

  private boolean isRetryableStatus(int status) {
    return status == 429 || (status >= 500 && status < 600);
  }

  private Duration elapsedSince(Instant startedAt) {
    return Duration.between(startedAt, clock.instant());
  }
}
