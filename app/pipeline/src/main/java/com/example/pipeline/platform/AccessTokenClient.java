/*
 * Where: pipeline platform layer
 * What: OAuth2 client-credentials token acquisition with a per-scope cache
 * Why: both the job platform and the subscription API authenticate as the same app
 */
package com.example.pipeline.platform;

import com.example.pipeline.config.IdentityProperties;
import com.example.pipeline.platform.dto.TokenResponse;
import edu.umd.cs.findbugs.annotations.SuppressFBWarnings;
import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ConcurrentMap;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.http.MediaType;
import org.springframework.stereotype.Component;
import org.springframework.util.LinkedMultiValueMap;
import org.springframework.util.MultiValueMap;
import org.springframework.web.client.RestClient;

@Component
public class AccessTokenClient {

  private static final Logger logger = LoggerFactory.getLogger(AccessTokenClient.class);
  private static final Duration EXPIRY_SKEW = Duration.ofSeconds(60);

  private record CachedToken(String value, Instant expiresAt) {}

  private final RestClient identityRestClient;
  private final IdentityProperties properties;
  private final Clock clock;
  private final ConcurrentMap<String, CachedToken> cache = new ConcurrentHashMap<>();

  @SuppressFBWarnings(
      value = "EI_EXPOSE_REP2",
      justification = "RestClient is a Spring-managed shared component and cannot be copied")
  public AccessTokenClient(
      @Qualifier("identityRestClient") RestClient identityRestClient,
      IdentityProperties properties,
      Clock clock) {
    this.identityRestClient = identityRestClient;
    this.properties = properties;
    this.clock = clock;
  }

  public List<String> missingCredentials() {
    final List<String> missing = new ArrayList<>();
    if (isBlank(properties.tenantId())) {
      missing.add("pipeline.identity.tenant-id");
    }
    if (isBlank(properties.clientId())) {
      missing.add("pipeline.identity.client-id");
    }
    if (isBlank(properties.clientSecret())) {
      missing.add("pipeline.identity.client-secret");
    }
    return missing;
  }

  /**
   * Returns a bearer token for the scope, from cache while it is still valid.
   *
   * <p>HTTP and transport failures surface as the underlying {@code RestClientException} so
   * callers can classify them as retryable or not.
   */
  public String acquire(String scope) {
    final Instant now = clock.instant();
    final CachedToken cached = cache.get(scope);
    if (cached != null && now.isBefore(cached.expiresAt())) {
      return cached.value();
    }
    final MultiValueMap<String, String> form = new LinkedMultiValueMap<>();
    form.add("grant_type", "client_credentials");
    form.add("client_id", properties.clientId());
    form.add("client_secret", properties.clientSecret());
    form.add("scope", scope);
    final TokenResponse response =
        identityRestClient
            .post()
            .uri(properties.tokenUrl(), properties.tenantId())
            .contentType(MediaType.APPLICATION_FORM_URLENCODED)
            .body(form)
            .retrieve()
            .body(TokenResponse.class);
    if (response == null || isBlank(response.accessToken())) {
      throw new IllegalStateException("token response did not contain an access_token");
    }
    final long expiresIn = response.expiresIn() == null ? 0L : response.expiresIn();
    final Instant expiresAt = now.plusSeconds(expiresIn).minus(EXPIRY_SKEW);
    cache.put(scope, new CachedToken(response.accessToken(), expiresAt));
    logger.debug("access token acquired scope={} expiresIn={}s", scope, expiresIn);
    return response.accessToken();
  }

  private boolean isBlank(String value) {
    return value == null || value.isBlank();
  }
}
