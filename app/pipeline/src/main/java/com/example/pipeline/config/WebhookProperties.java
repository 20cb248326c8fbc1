/*
 * Where: pipeline configuration binding
 * What: shared secret and resource-type filter for push notifications
 * Why: the ingestor refuses to start without a client state to compare against
 */
package com.example.pipeline.config;

import jakarta.validation.constraints.NotBlank;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.validation.annotation.Validated;

@ConfigurationProperties(prefix = "pipeline.webhook")
@Validated
public record WebhookProperties(@NotBlank String clientState, @NotBlank String resourceType) {}
