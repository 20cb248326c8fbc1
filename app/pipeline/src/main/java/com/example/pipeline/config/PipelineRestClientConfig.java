/*
 * Where: pipeline configuration
 * What: one RestClient per downstream (job platform, identity, subscription API, chat, cancel check)
 * Why: each downstream has its own base URL and timeout budget
 */
package com.example.pipeline.config;

import java.time.Duration;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.http.client.SimpleClientHttpRequestFactory;
import org.springframework.web.client.RestClient;

@Configuration
public class PipelineRestClientConfig {

  private static final Duration PLATFORM_TIMEOUT = Duration.ofSeconds(30);

  @Bean
  RestClient jobPlatformRestClient(RestClient.Builder builder, JobPlatformProperties properties) {
    return builder
        .clone()
        .baseUrl(properties.apiBaseUrl())
        .requestFactory(requestFactory(PLATFORM_TIMEOUT))
        .build();
  }

  @Bean
  RestClient identityRestClient(
      RestClient.Builder builder, SubscriptionRenewalProperties properties) {
    return builder.clone().requestFactory(requestFactory(properties.requestTimeout())).build();
  }

  @Bean
  RestClient graphRestClient(RestClient.Builder builder, SubscriptionRenewalProperties properties) {
    return builder
        .clone()
        .baseUrl(properties.graphBaseUrl())
        .requestFactory(requestFactory(properties.requestTimeout()))
        .build();
  }

  @Bean
  RestClient chatRestClient(RestClient.Builder builder, ChatNotificationProperties properties) {
    return builder.clone().requestFactory(requestFactory(properties.requestTimeout())).build();
  }

  @Bean
  RestClient cancellationCheckRestClient(
      RestClient.Builder builder, ChatNotificationProperties properties) {
    return builder.clone().requestFactory(requestFactory(properties.requestTimeout())).build();
  }

  private SimpleClientHttpRequestFactory requestFactory(Duration timeout) {
    final SimpleClientHttpRequestFactory factory = new SimpleClientHttpRequestFactory();
    factory.setConnectTimeout(timeout);
    factory.setReadTimeout(timeout);
    return factory;
  }
}
