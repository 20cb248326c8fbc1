/*
 * Where: pipeline configuration binding
 * What: target job definition, container image, callback URLs and the job's full environment
 * Why: the platform replaces the env array on every start, so every value lives here
 */
package com.example.pipeline.config;

import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import org.springframework.boot.context.properties.ConfigurationProperties;

@ConfigurationProperties(prefix = "pipeline.job")
public record JobPlatformProperties(
    String subscriptionId,
    String resourceGroup,
    String jobName,
    String image,
    String containerName,
    String apiBaseUrl,
    String apiVersion,
    String tokenScope,
    String cancelUrl,
    String checkCancelledUrl,
    String publicHostname,
    Map<String, String> staticEnv,
    Map<String, String> secretEnv) {

  public JobPlatformProperties {
    containerName =
        containerName == null || containerName.isBlank() ? "transcript-processor" : containerName;
    apiBaseUrl =
        apiBaseUrl == null || apiBaseUrl.isBlank() ? "https://management.azure.com" : apiBaseUrl;
    apiVersion = apiVersion == null || apiVersion.isBlank() ? "2024-03-01" : apiVersion;
    tokenScope =
        tokenScope == null || tokenScope.isBlank()
            ? "https://management.azure.com/.default"
            : tokenScope;
    // insertion order is kept so the job sees a stable env layout
    staticEnv =
        staticEnv == null
            ? Map.of()
            : Collections.unmodifiableMap(new LinkedHashMap<>(staticEnv));
    secretEnv =
        secretEnv == null
            ? Map.of()
            : Collections.unmodifiableMap(new LinkedHashMap<>(secretEnv));
  }

  /** Keys needed to address the job definition on the platform. */
  public List<String> missingPlatformKeys() {
    final List<String> missing = new ArrayList<>();
    addIfBlank(missing, "pipeline.job.subscription-id", subscriptionId);
    addIfBlank(missing, "pipeline.job.resource-group", resourceGroup);
    return missing;
  }

  /** Keys needed to start an execution. */
  public List<String> missingDispatchKeys() {
    final List<String> missing = missingPlatformKeys();
    addIfBlank(missing, "pipeline.job.job-name", jobName);
    addIfBlank(missing, "pipeline.job.image", image);
    return missing;
  }

  private static void addIfBlank(List<String> missing, String key, String value) {
    if (value == null || value.isBlank()) {
      missing.add(key);
    }
  }
}
