package io.petfeeder.backend.config;

import org.springframework.boot.context.properties.ConfigurationProperties;

/**
 * Top-level feeder settings.
 *
 * @param environment deployment environment ({@code dev}, {@code demo} or {@code prod}); recorded
 *     on every execution history row
 * @param schedules schedule API settings
 */
@ConfigurationProperties(prefix = "feeder")
public record FeederProperties(String environment, Schedules schedules) {

  /**
   * @param requireFutureTime whether a newly created schedule must lie in the future
   */
  public record Schedules(boolean requireFutureTime) {}

  public boolean requireFutureTime() {
    return schedules != null && schedules.requireFutureTime();
  }
}
