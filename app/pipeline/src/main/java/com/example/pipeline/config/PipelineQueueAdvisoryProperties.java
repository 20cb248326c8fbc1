/*
 * Where: pipeline configuration binding
 * What: subject/stream/durable of the JetStream MaxDeliver advisory
 * Why: messages that exhaust max-deliver must surface as dead letters
 */
package com.example.pipeline.config;

import jakarta.validation.constraints.NotBlank;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.validation.annotation.Validated;

@ConfigurationProperties(prefix = "pipeline.queue.advisory")
@Validated
public record PipelineQueueAdvisoryProperties(
    @NotBlank String subject, @NotBlank String stream, @NotBlank String durable) {}
