/*
 * Where: Shared configuration
 * What: Exposes a Clock bean
 * Why: Every deadline and window computation reads time from one injectable source
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
