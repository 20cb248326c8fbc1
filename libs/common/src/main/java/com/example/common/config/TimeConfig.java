/*
 * Where: shared configuration
 * What: exposes a UTC Clock bean
 * Why: TTL stores, dispatch timestamps and renewal expiry all read the same injectable clock
 */
package com.example.common.config;

import java.time.Clock;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

@Configuration
public class TimeConfig {

  @Bean
  public Clock clock() {
    return Clock.systemUTC();
  }
}
