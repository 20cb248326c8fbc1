package com.example.pipeline.subscription;

import edu.umd.cs.findbugs.annotations.SuppressFBWarnings;
import java.time.Instant;
import java.util.Map;
import java.util.UUID;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.http.HttpHeaders;
import org.springframework.http.MediaType;
import org.springframework.stereotype.Component;
import org.springframework.web.client.RestClient;

/** Extends a push subscription's expiry with {@code PATCH /subscriptions/{id}}. */
@Component
public class GraphSubscriptionClient {

  private final RestClient graphRestClient;

  @SuppressFBWarnings(
      value = "EI_EXPOSE_REP2",
      justification = "RestClient is a Spring-managed shared component and cannot be copied")
  public GraphSubscriptionClient(@Qualifier("graphRestClient") RestClient graphRestClient) {
    this.graphRestClient = graphRestClient;
  }

  /** Throws the underlying {@code RestClientException} so the caller can decide on a retry. */
  public void renew(String subscriptionId, Instant newExpiry, String accessToken) {
    graphRestClient
        .patch()
        .uri("/subscriptions/{subscriptionId}", subscriptionId)
        .header(HttpHeaders.AUTHORIZATION, "Bearer " + accessToken)
        .header("request-id", UUID.randomUUID().toString())
        .contentType(MediaType.APPLICATION_JSON)
        .body(Map.of("expirationDateTime", newExpiry.toString()))
        .retrieve()
        .toBodilessEntity();
  }
}
