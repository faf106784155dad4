package org.budgetanalyzer.fxrates.config;

import java.time.Clock;

import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

/**
 * Main configuration class for the FX Rates Service.
 *
 * <p>Note: ObjectMapper is auto-configured by Spring Boot using spring.jackson.* properties in
 * application.yml. JavaTimeModule is registered automatically, which is what lets the Frankfurter
 * response records use {@code LocalDate} keys.
 */
@Configuration
@EnableConfigurationProperties(FxRatesServiceProperties.class)
public class FxRatesServiceConfig {

  /**
   * Clock used to decide what "today" is when building the monthly rate window.
   *
   * @return system clock in the default time zone
   */
  @Bean
  public Clock clock() {
    return Clock.systemDefaultZone();
  }
}
