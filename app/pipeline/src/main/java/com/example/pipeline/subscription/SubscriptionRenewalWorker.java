package com.example.pipeline.subscription;

import lombok.RequiredArgsConstructor;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.scheduling.annotation.Scheduled;
import org.springframework.stereotype.Component;

@Component
@RequiredArgsConstructor
@ConditionalOnProperty(
    name = "pipeline.subscription.enabled",
    havingValue = "true",
    matchIfMissing = true)
public class SubscriptionRenewalWorker {

  private final SubscriptionRenewalService renewalService;

  @Scheduled(cron = "${pipeline.subscription.cron:0 0 0 * * *}", zone = "UTC")
  public void renew() {
    renewalService.renew();
  }
}
