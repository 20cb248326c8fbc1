/*
 * Where: pipeline configuration binding
 * What: TTLs of the dedup cache, execution tracker and cancellation marks
 * Why: dedup TTL must exceed the upstream redelivery window and execution TTL the longest job
 */
package com.example.pipeline.config;

import jakarta.validation.constraints.NotNull;
import java.time.Duration;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.validation.annotation.Validated;

@ConfigurationProperties(prefix = "pipeline.cache")
@Validated
public record PipelineCacheProperties(
    @NotNull Duration dedupTtl,
    @NotNull Duration executionTtl,
    @NotNull Duration cancellationMarkTtl) {}
