/*
 * Where: pipeline service layer
 * What: stops a running execution by pipeline execution id
 * Why: the mapping may be gone (restart, TTL), so an exactly-one-running fallback is needed
 */
package com.example.pipeline.service;

import com.example.pipeline.config.JobPlatformProperties;
import com.example.pipeline.model.CancellationOutcome;
import com.example.pipeline.model.CancellationResult;
import com.example.pipeline.model.ExecutionRecord;
import com.example.pipeline.model.JobExecution;
import com.example.pipeline.platform.JobPlatformClient;
import com.example.pipeline.platform.JobPlatformException;
import java.util.List;
import java.util.Optional;
import lombok.RequiredArgsConstructor;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.slf4j.MDC;
import org.springframework.stereotype.Service;

@Service
@RequiredArgsConstructor
public class CancellationService {

  private static final Logger logger = LoggerFactory.getLogger(CancellationService.class);

  private final ExecutionTracker executionTracker;
  private final CancellationMarkStore cancellationMarks;
  private final JobPlatformClient jobPlatformClient;
  private final ChatNotifier chatNotifier;
  private final JobPlatformProperties properties;
  private final PipelineMetrics metrics;

  public CancellationResult cancel(String executionId, String jobRef) {
    if (executionId == null || executionId.isBlank()) {
      throw new IllegalArgumentException("executionId is required");
    }
    // the running job polls this mark, so it is recorded whatever happens below
    cancellationMarks.mark(executionId);
    MDC.put("execution_id", executionId);
    try {
      final Optional<ExecutionRecord> record = executionTracker.find(executionId);
      final CancellationResult result =
          record.isPresent()
              ? cancelTracked(record.get())
              : cancelSoleRunning(executionId, resolveJobName(jobRef));
      metrics.recordCancellation(result.outcome().name());
      logger.info(
          "cancellation handled executionId={} outcome={} reason={}",
          executionId,
          result.outcome(),
          result.reason());
      if (result.stopped() || result.outcome() == CancellationOutcome.ALREADY_COMPLETED) {
        notifyCancelled(executionId);
      }
      return result;
    } finally {
      MDC.remove("execution_id");
    }
  }

  public boolean isCancellationRequested(String executionId) {
    return cancellationMarks.isMarked(executionId);
  }

  private CancellationResult cancelTracked(ExecutionRecord record) {
    final String executionId = record.executionId();
    try {
      final JobExecution execution =
          jobPlatformClient.getExecution(record.jobName(), record.executionName());
      if (!execution.isActive()) {
        executionTracker.remove(executionId);
        return new CancellationResult(
            executionId, CancellationOutcome.ALREADY_COMPLETED, "already completed");
      }
      jobPlatformClient.stop(record.jobName(), record.executionName());
      executionTracker.remove(executionId);
      return new CancellationResult(
          executionId, CancellationOutcome.STOPPED, "stopped execution " + record.executionName());
    } catch (JobPlatformException ex) {
      if (ex.reason() == JobPlatformException.Reason.NOT_FOUND) {
        executionTracker.remove(executionId);
        return new CancellationResult(
            executionId, CancellationOutcome.ALREADY_COMPLETED, "already completed");
      }
      // the record stays so a retried cancel can try the same execution again
      logger.warn("stop failed executionId={} executionName={}", executionId,
          record.executionName(), ex);
      return new CancellationResult(
          executionId, CancellationOutcome.STOP_FAILED, "stop failed: " + ex.getMessage());
    }
  }

  private CancellationResult cancelSoleRunning(String executionId, String jobName) {
    try {
      final List<JobExecution> active =
          jobPlatformClient.listExecutions(jobName).stream().filter(JobExecution::isActive).toList();
      if (active.isEmpty()) {
        return new CancellationResult(
            executionId,
            CancellationOutcome.NOT_RUNNING,
            "nothing to cancel, may have already completed");
      }
      if (active.size() > 1) {
        logger.warn(
            "refusing to cancel, {} executions running for job {} executionId={}",
            active.size(),
            jobName,
            executionId);
        return new CancellationResult(
            executionId,
            CancellationOutcome.CONFLICT,
            active.size() + " executions are running; cannot tell which one to stop");
      }
      final String executionName = active.get(0).name();
      jobPlatformClient.stop(jobName, executionName);
      return new CancellationResult(
          executionId, CancellationOutcome.STOPPED, "stopped execution " + executionName);
    } catch (JobPlatformException ex) {
      logger.warn("stop by listing failed executionId={} jobName={}", executionId, jobName, ex);
      return new CancellationResult(
          executionId, CancellationOutcome.STOP_FAILED, "stop failed: " + ex.getMessage());
    }
  }

  private String resolveJobName(String jobRef) {
    if (jobRef != null && !jobRef.isBlank()) {
      return jobRef;
    }
    if (properties.jobName() == null || properties.jobName().isBlank()) {
      throw new PipelineConfigurationException(List.of("pipeline.job.job-name"));
    }
    return properties.jobName();
  }

  private void notifyCancelled(String executionId) {
    try {
      chatNotifier.notifyCancelled(executionId);
    } catch (RuntimeException ex) {
      logger.warn("cancelled notification failed executionId={}", executionId, ex);
    }
  }
}
