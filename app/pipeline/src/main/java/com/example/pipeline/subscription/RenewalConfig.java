package com.example.pipeline.subscription;

import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

@Configuration
public class RenewalConfig {

  @Bean
  RetrySleeper retrySleeper() {
    return delay -> Thread.sleep(delay.toMillis());
  }
}
