/*
 * Where: pipeline service layer
 * What: turns one accepted notification into one job execution and remembers the mapping
 * Why: the job receives everything it needs (ids, callback URLs, secrets) as environment
 */
package com.example.pipeline.service;

import com.example.pipeline.config.JobPlatformProperties;
import com.example.pipeline.model.ExecutionRecord;
import com.example.pipeline.model.JobParameter;
import com.example.pipeline.model.JobStartRequest;
import com.example.pipeline.model.TranscriptNotification;
import com.example.pipeline.model.WorkKey;
import com.example.pipeline.platform.JobPlatformClient;
import com.google.common.annotations.VisibleForTesting;
import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.concurrent.atomic.AtomicLong;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;
import org.springframework.web.util.UriComponentsBuilder;

@Service
public class JobDispatcher {

  private static final Logger logger = LoggerFactory.getLogger(JobDispatcher.class);

  static final String ENV_USER_ID = "GRAPH_USER_ID";
  static final String ENV_MEETING_ID = "GRAPH_MEETING_ID";
  static final String ENV_TRANSCRIPT_ID = "GRAPH_TRANSCRIPT_ID";
  static final String ENV_EXECUTION_ID = "JOB_EXECUTION_ID";
  static final String ENV_CANCEL_URL = "CANCEL_URL";
  static final String ENV_CHECK_CANCELLED_URL = "CHECK_CANCELLED_URL";

  private final JobPlatformClient jobPlatformClient;
  private final ExecutionTracker executionTracker;
  private final JobPlatformProperties properties;
  private final PipelineMetrics metrics;
  private final Clock clock;
  private final AtomicLong lastIssuedMillis = new AtomicLong();

  public JobDispatcher(
      JobPlatformClient jobPlatformClient,
      ExecutionTracker executionTracker,
      JobPlatformProperties properties,
      PipelineMetrics metrics,
      Clock clock) {
    this.jobPlatformClient = jobPlatformClient;
    this.executionTracker = executionTracker;
    this.properties = properties;
    this.metrics = metrics;
    this.clock = clock;
  }

  /**
   * Starts one execution for the notification.
   *
   * @return the pipeline execution id
   * @throws PipelineConfigurationException when the job target is not configured
   * @throws com.example.pipeline.platform.JobPlatformException when the start call fails
   */
  public String dispatch(TranscriptNotification notification) {
    final List<String> missing = properties.missingDispatchKeys();
    if (!missing.isEmpty()) {
      throw new PipelineConfigurationException(missing);
    }
    final String executionId = nextExecutionId(notification.workKey());
    final JobStartRequest request =
        new JobStartRequest(
            properties.jobName(),
            properties.containerName(),
            properties.image(),
            buildParameters(notification, executionId));

    final Instant startedAt = clock.instant();
    final String executionName = jobPlatformClient.start(request);
    final Instant dispatchedAt = clock.instant();
    metrics.recordDispatch(Duration.between(startedAt, dispatchedAt));

    executionTracker.track(
        new ExecutionRecord(executionId, executionName, properties.jobName(), dispatchedAt));
    logger.info(
        "job dispatched executionId={} executionName={} jobName={} workKey={}",
        executionId,
        executionName,
        properties.jobName(),
        notification.workKey());
    return executionId;
  }

  @VisibleForTesting
  String nextExecutionId(WorkKey key) {
    final long now = clock.millis();
    // two dispatches in the same millisecond still get distinct ids
    final long issued = lastIssuedMillis.updateAndGet(previous -> Math.max(now, previous + 1));
    return key.value() + "-" + issued;
  }

  @VisibleForTesting
  List<JobParameter> buildParameters(TranscriptNotification notification, String executionId) {
    final List<JobParameter> parameters = new ArrayList<>();
    parameters.add(JobParameter.plain(ENV_USER_ID, notification.userId()));
    parameters.add(JobParameter.plain(ENV_MEETING_ID, notification.meetingId()));
    parameters.add(JobParameter.plain(ENV_TRANSCRIPT_ID, notification.transcriptId()));
    parameters.add(JobParameter.plain(ENV_EXECUTION_ID, executionId));
    final String cancelUrl = callbackUrl(properties.cancelUrl(), "/api/cancel", executionId);
    if (cancelUrl == null) {
      logger.warn("no cancel url configured, job {} will not offer cancellation", executionId);
    } else {
      parameters.add(JobParameter.plain(ENV_CANCEL_URL, cancelUrl));
    }
    final String checkUrl =
        callbackUrl(properties.checkCancelledUrl(), "/api/check-cancelled", executionId);
    if (checkUrl != null) {
      parameters.add(JobParameter.plain(ENV_CHECK_CANCELLED_URL, checkUrl));
    }

    final Set<String> taken = new LinkedHashSet<>();
    parameters.forEach(parameter -> taken.add(parameter.name()));
    for (Map.Entry<String, String> entry : properties.staticEnv().entrySet()) {
      if (taken.add(entry.getKey())) {
        parameters.add(JobParameter.plain(entry.getKey(), entry.getValue()));
      }
    }
    for (Map.Entry<String, String> entry : properties.secretEnv().entrySet()) {
      if (taken.add(entry.getKey())) {
        parameters.add(JobParameter.secret(entry.getKey(), entry.getValue()));
      }
    }
    return parameters;
  }

  private String callbackUrl(String configured, String path, String executionId) {
    final String base;
    if (configured != null && !configured.isBlank()) {
      base = configured;
    } else if (properties.publicHostname() != null && !properties.publicHostname().isBlank()) {
      base = "https://" + properties.publicHostname() + path;
    } else {
      return null;
    }
    return UriComponentsBuilder.fromUriString(base)
        .queryParam("executionId", executionId)
        .queryParam("jobRef", properties.jobName())
        .encode()
        .build()
        .toUriString();
  }
}
