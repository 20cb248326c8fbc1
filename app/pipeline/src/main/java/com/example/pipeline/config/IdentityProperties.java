/*
 * Where: pipeline configuration binding
 * What: client-credentials identity used for both the job platform and the subscription API
 * Why: one app registration owns both scopes
 */
package com.example.pipeline.config;

import org.springframework.boot.context.properties.ConfigurationProperties;

@ConfigurationProperties(prefix = "pipeline.identity")
public record IdentityProperties(
    String tenantId, String clientId, String clientSecret, String tokenUrl) {

  public IdentityProperties {
    tokenUrl =
        tokenUrl == null || tokenUrl.isBlank()
            ? "https://login.microsoftonline.com/{tenantId}/oauth2/v2.0/token"
            : tokenUrl;
  }
}
