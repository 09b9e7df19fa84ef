package com.scholary.transcriber.config;

import java.time.Clock;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

/** Clock used for task timestamps; replaced by a fixed clock in tests. */
@Configuration
public class TimeConfig {

  @Bean
  public Clock systemClock() {
    return Clock.systemUTC();
  }
}
