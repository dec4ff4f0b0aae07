/*
 * Where: Common configuration
 * What: Exposes a UTC Clock as a bean
 * Why: Queue scores, backoff deadlines and persisted timestamps share one injectable time source
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
