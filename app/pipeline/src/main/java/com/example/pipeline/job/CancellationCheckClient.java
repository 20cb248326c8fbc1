package com.example.pipeline.job;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.databind.PropertyNamingStrategies;
import com.fasterxml.jackson.databind.annotation.JsonNaming;
import edu.umd.cs.findbugs.annotations.SuppressFBWarnings;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.stereotype.Component;
import org.springframework.web.client.RestClient;
import org.springframework.web.client.RestClientException;

/** Asks the pipeline whether this execution has been cancelled. */
@Component
public class CancellationCheckClient {

  private static final Logger logger = LoggerFactory.getLogger(CancellationCheckClient.class);

  @JsonIgnoreProperties(ignoreUnknown = true)
  @JsonNaming(PropertyNamingStrategies.SnakeCaseStrategy.class)
  record CheckCancelledBody(String executionId, boolean cancelled) {}

  private final RestClient cancellationCheckRestClient;

  @SuppressFBWarnings(
      value = "EI_EXPOSE_REP2",
      justification = "RestClient is a Spring-managed shared component and cannot be copied")
  public CancellationCheckClient(
      @Qualifier("cancellationCheckRestClient") RestClient cancellationCheckRestClient) {
    this.cancellationCheckRestClient = cancellationCheckRestClient;
  }

  /** A failed check counts as "not cancelled"; the next tick asks again. */
  public boolean isCancelled(String checkUrl) {
    if (checkUrl == null || checkUrl.isBlank()) {
      return false;
    }
    try {
      final CheckCancelledBody body =
          cancellationCheckRestClient.get().uri(checkUrl).retrieve().body(CheckCancelledBody.class);
      return body != null && body.cancelled();
    } catch (RestClientException ex) {
      logger.warn("cancellation check failed url={}: {}", checkUrl, ex.getMessage());
      return false;
    }
  }
}
