package com.example.pipeline.platform;

import com.example.pipeline.model.JobExecution;
import com.example.pipeline.model.JobStartRequest;
import java.util.List;

/**
 * Job-execution platform operations used by dispatch and cancellation.
 *
 * <p>Every method throws {@link JobPlatformException} when the platform call fails.
 */
public interface JobPlatformClient {

  /** Starts one execution with a full parameter replacement and returns its platform name. */
  String start(JobStartRequest request);

  JobExecution getExecution(String jobName, String executionName);

  void stop(String jobName, String executionName);

  List<JobExecution> listExecutions(String jobName);
}
