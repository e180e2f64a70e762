package io.petfeeder.backend.feed;

import java.time.Duration;
import org.springframework.boot.context.properties.ConfigurationProperties;

/**
 * @param defaultWeightThresholdG threshold used when {@code WEIGHT_THRESHOLD_G} is not configured
 * @param thresholdCacheTtl how long a threshold read from the settings table is reused
 * @param simulatedWeightG bowl weight reported by the simulated device
 */
@ConfigurationProperties("feeder.feed")
public record FeedProperties(
    double defaultWeightThresholdG, Duration thresholdCacheTtl, double simulatedWeightG) {

  public static final double DEFAULT_WEIGHT_THRESHOLD_G = 450.0;

  public FeedProperties {
    if (defaultWeightThresholdG <= 0) {
      defaultWeightThresholdG = DEFAULT_WEIGHT_THRESHOLD_G;
    }
    if (thresholdCacheTtl == null) {
      thresholdCacheTtl = Duration.ofSeconds(60);
    }
  }
}
