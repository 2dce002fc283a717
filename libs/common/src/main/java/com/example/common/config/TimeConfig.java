/*
 * Where: Common configuration
 * What: Exposes the UTC Clock bean
 * Why: Schedulers and repositories read "now" from one injectable source so tests can pin it
 */
package com.example.common.config;

import java.time.Clock;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

@Configuration(proxyBeanMethods = false)
public class TimeConfig {

  @Bean
  public Clock utcClock() {
    return Clock.systemUTC();
  }
}
