package com.example.pipeline.subscription;

import static org.assertj.core.api.Assertions.assertThat;

import com.example.pipeline.MutableClock;
import com.example.pipeline.config.SubscriptionRenewalProperties;
import java.nio.charset.StandardCharsets;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.atomic.AtomicInteger;
import org.junit.jupiter.api.Test;
import org.springframework.http.HttpHeaders;
import org.springframework.http.HttpStatus;
import org.springframework.web.client.HttpClientErrorException;
import org.springframework.web.client.HttpServerErrorException;
import org.springframework.web.client.ResourceAccessException;

class RenewalRetryExecutorTest {

  private final MutableClock clock = new MutableClock(Instant.parse("2026-03-01T00:00:00Z"));
  private final List<Duration> sleeps = new ArrayList<>();
  private final RetrySleeper sleeper =
      delay -> {
        sleeps.add(delay);
        clock.advance(delay);
      };

  @Test
  void serverErrorsAreRetriedUntilExhausted() {
    final RenewalRetryExecutor executor = new RenewalRetryExecutor(properties(4), sleeper, clock);
    final AtomicInteger calls = new AtomicInteger();

    final RetryOutcome<String> outcome =
        executor.execute(
            "renewal",
            () -> {
              calls.incrementAndGet();
              throw HttpServerErrorException.create(
                  HttpStatus.SERVICE_UNAVAILABLE, "Service Unavailable", null, null, null);
            });

    assertThat(outcome.status()).isEqualTo(RetryOutcome.Status.RETRIES_EXHAUSTED);
    assertThat(outcome.attempts()).isEqualTo(4);
    assertThat(calls.get()).isEqualTo(4);
    assertThat(sleeps).hasSize(3);
    assertThat(outcome.lastError()).isInstanceOf(HttpServerErrorException.class);
    assertThat(outcome.elapsed()).isEqualTo(sleeps.stream().reduce(Duration.ZERO, Duration::plus));
  }

  @Test
  void successAfterTransportFailureReportsAttempts() {
    final RenewalRetryExecutor executor = new RenewalRetryExecutor(properties(3), sleeper, clock);
    final AtomicInteger calls = new AtomicInteger();

    final RetryOutcome<String> outcome =
        executor.execute(
            "renewal",
            () -> {
              if (calls.incrementAndGet() == 1) {
                throw new ResourceAccessException("connection reset");
              }
              return "ok";
            });

    assertThat(outcome.succeeded()).isTrue();
    assertThat(outcome.value()).isEqualTo("ok");
    assertThat(outcome.attempts()).isEqualTo(2);
    assertThat(sleeps).hasSize(1);
  }

  @Test
  void retryAfterHeaderIsHonoredAndCapped() {
    final RenewalRetryExecutor executor = new RenewalRetryExecutor(properties(3), sleeper, clock);
    final AtomicInteger calls = new AtomicInteger();

    executor.execute(
        "renewal",
        () -> {
          final HttpHeaders headers = new HttpHeaders();
          headers.set(HttpHeaders.RETRY_AFTER, calls.incrementAndGet() == 1 ? "7" : "3600");
          throw HttpClientErrorException.create(
              HttpStatus.TOO_MANY_REQUESTS,
              "Too Many Requests",
              headers,
              new byte[0],
              StandardCharsets.UTF_8);
        });

    assertThat(sleeps).containsExactly(Duration.ofSeconds(7), Duration.ofMinutes(2));
  }

  @Test
  void clientErrorIsNotRetried() {
    final RenewalRetryExecutor executor = new RenewalRetryExecutor(properties(3), sleeper, clock);

    final RetryOutcome<String> outcome =
        executor.execute(
            "renewal",
            () -> {
              throw HttpClientErrorException.create(
                  HttpStatus.BAD_REQUEST, "Bad Request", null, null, null);
            });

    assertThat(outcome.status()).isEqualTo(RetryOutcome.Status.NON_RETRYABLE);
    assertThat(outcome.attempts()).isEqualTo(1);
    assertThat(sleeps).isEmpty();
  }

  @Test
  void interruptedWaitStopsRetrying() {
    final RenewalRetryExecutor executor =
        new RenewalRetryExecutor(
            properties(3),
            delay -> {
              throw new InterruptedException("shutdown");
            },
            clock);

    final RetryOutcome<String> outcome =
        executor.execute(
            "renewal",
            () -> {
              throw new ResourceAccessException("connection refused");
            });

    assertThat(outcome.status()).isEqualTo(RetryOutcome.Status.INTERRUPTED);
    assertThat(outcome.attempts()).isEqualTo(1);
    assertThat(Thread.interrupted()).isTrue();
  }

  @Test
  void backoffGrowsAndNeverExceedsCap() {
    final RenewalRetryExecutor executor = new RenewalRetryExecutor(properties(10), sleeper, clock);

    Duration previous = Duration.ZERO;
    for (int attempt = 1; attempt <= 10; attempt++) {
      final Duration delay = executor.backoff(attempt);
      assertThat(delay).isGreaterThanOrEqualTo(previous);
      assertThat(delay).isLessThanOrEqualTo(Duration.ofSeconds(30));
      previous = delay;
    }
    assertThat(executor.backoff(1))
        .isBetween(Duration.ofSeconds(2), Duration.ofMillis(3999));
  }

  private static SubscriptionRenewalProperties properties(int maxAttempts) {
    return new SubscriptionRenewalProperties(
        true,
        "sub-1",
        null,
        null,
        null,
        maxAttempts,
        null,
        Duration.ofSeconds(2),
        Duration.ofSeconds(30),
        Duration.ofMinutes(2));
  }
}
