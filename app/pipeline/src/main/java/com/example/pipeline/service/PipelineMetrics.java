/*
 * Where: pipeline service layer
 * What: app-specific counters for ingest, queue handling, cancellation and renewal
 * Why: rejected entries and dead letters are otherwise only visible in logs
 */
package com.example.pipeline.service;

import edu.umd.cs.findbugs.annotations.SuppressFBWarnings;
import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.Tags;
import io.micrometer.core.instrument.Timer;
import java.time.Duration;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ConcurrentMap;
import org.springframework.stereotype.Component;

@Component
@SuppressFBWarnings(
    value = "EI_EXPOSE_REP2",
    justification = "MeterRegistry is a Spring-managed shared component and cannot be copied")
public class PipelineMetrics {

  static final String METRIC_WEBHOOK_ENTRIES_TOTAL = "pipeline.webhook.entries.total";
  static final String METRIC_QUEUE_MESSAGES_TOTAL = "pipeline.queue.messages.total";
  static final String METRIC_DEAD_LETTER_TOTAL = "pipeline.queue.dead_letter.total";
  static final String METRIC_DISPATCH_DURATION = "pipeline.dispatch.duration";
  static final String METRIC_CANCELLATION_TOTAL = "pipeline.cancellation.total";
  static final String METRIC_RENEWAL_TOTAL = "pipeline.subscription.renewal.total";

  private final MeterRegistry meterRegistry;
  private final ConcurrentMap<String, Counter> counters = new ConcurrentHashMap<>();
  private final Counter deadLetterCounter;
  private final Timer dispatchTimer;

  public PipelineMetrics(MeterRegistry meterRegistry) {
    this.meterRegistry = meterRegistry;
    this.deadLetterCounter =
        Counter.builder(METRIC_DEAD_LETTER_TOTAL)
            .description("Queue messages that exhausted max-deliver")
            .register(meterRegistry);
    this.dispatchTimer =
        Timer.builder(METRIC_DISPATCH_DURATION)
            .description("Latency of job start calls")
            .register(meterRegistry);
  }

  public void recordWebhookEntries(int accepted, int rejected) {
    if (accepted > 0) {
      counter(METRIC_WEBHOOK_ENTRIES_TOTAL, "result", "accepted").increment(accepted);
    }
    if (rejected > 0) {
      counter(METRIC_WEBHOOK_ENTRIES_TOTAL, "result", "rejected").increment(rejected);
    }
  }

  public void recordQueueMessage(String result) {
    counter(METRIC_QUEUE_MESSAGES_TOTAL, "result", result).increment();
  }

  public void recordDeadLetter() {
    deadLetterCounter.increment();
  }

  public void recordDispatch(Duration duration) {
    if (duration == null || duration.isNegative()) {
      return;
    }
    dispatchTimer.record(duration);
  }

  public void recordCancellation(String outcome) {
    counter(METRIC_CANCELLATION_TOTAL, "outcome", outcome).increment();
  }

  public void recordRenewal(String result) {
    counter(METRIC_RENEWAL_TOTAL, "result", result).increment();
  }

  private Counter counter(String name, String tagKey, String tagValue) {
    return counters.computeIfAbsent(
        name + '|' + tagValue,
        ignored ->
            Counter.builder(name).tags(Tags.of(tagKey, tagValue)).register(meterRegistry));
  }
}
