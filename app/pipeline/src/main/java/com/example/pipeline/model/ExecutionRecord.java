package com.example.pipeline.model;

import java.time.Instant;

/**
 * Maps a pipeline execution id to the platform-side execution it started.
 *
 * @param executionId pipeline-generated id handed to the job and used by cancel requests
 * @param executionName platform-assigned execution name
 * @param jobName job definition the execution belongs to
 * @param dispatchedAt when the start call returned
 */
public record ExecutionRecord(
    String executionId, String executionName, String jobName, Instant dispatchedAt) {}
