package io.petfeeder.backend.feed;

import com.github.benmanes.caffeine.cache.Cache;
import com.github.benmanes.caffeine.cache.Caffeine;
import com.github.benmanes.caffeine.cache.Ticker;
import io.petfeeder.backend.device.DeviceStatus;
import io.petfeeder.backend.device.HardwareAdapter;
import io.petfeeder.backend.settings.FeederSettingsStore;
import java.util.Optional;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Component;

/**
 * Vetoes a feed while the bowl still holds at least {@code WEIGHT_THRESHOLD_G} grams. The gate
 * fails open: if the device status or the threshold cannot be read the feed is allowed.
 */
@Component
public class WeightSafetyGate {

  private static final Logger log = LoggerFactory.getLogger(WeightSafetyGate.class);

  /** Result of one check; {@code currentWeightG} and {@code thresholdG} are null when unchecked. */
  public record WeightCheck(boolean allowed, Double currentWeightG, Double thresholdG) {

    static WeightCheck unchecked() {
      return new WeightCheck(true, null, null);
    }
  }

  private final HardwareAdapter hardwareAdapter;
  private final FeederSettingsStore settingsStore;
  private final double defaultThresholdG;
  private final Cache<String, Double> thresholdCache;

  @Autowired
  public WeightSafetyGate(
      HardwareAdapter hardwareAdapter,
      FeederSettingsStore settingsStore,
      FeedProperties properties) {
    this(hardwareAdapter, settingsStore, properties, Ticker.systemTicker());
  }

  WeightSafetyGate(
      HardwareAdapter hardwareAdapter,
      FeederSettingsStore settingsStore,
      FeedProperties properties,
      Ticker ticker) {
    this.hardwareAdapter = hardwareAdapter;
    this.settingsStore = settingsStore;
    this.defaultThresholdG = properties.defaultWeightThresholdG();
    this.thresholdCache =
        Caffeine.newBuilder()
            .expireAfterWrite(properties.thresholdCacheTtl())
            .maximumSize(1)
            .ticker(ticker)
            .build();
  }

  public WeightCheck check() {
    try {
      Optional<DeviceStatus> status = hardwareAdapter.getDeviceStatus();
      if (status.isEmpty()) {
        return WeightCheck.unchecked();
      }
      double currentWeight =
          status.get().currentWeightG() != null ? status.get().currentWeightG() : 0.0;
      double threshold = thresholdG();
      if (currentWeight >= threshold) {
        log.info("Feed denied: current weight {}g >= threshold {}g", currentWeight, threshold);
        return new WeightCheck(false, currentWeight, threshold);
      }
      return new WeightCheck(true, currentWeight, threshold);
    } catch (RuntimeException e) {
      log.warn("Error checking weight threshold, proceeding with feed: {}", e.getMessage());
      return WeightCheck.unchecked();
    }
  }

  double thresholdG() {
    return thresholdCache.get(FeederSettingsStore.WEIGHT_THRESHOLD_G, this::loadThreshold);
  }

  /** Drops the cached threshold so the next check re-reads the settings table. */
  public void evictThreshold() {
    thresholdCache.invalidateAll();
  }

  private Double loadThreshold(String key) {
    Optional<String> configured = settingsStore.findValue(key);
    if (configured.isEmpty()) {
      return defaultThresholdG;
    }
    try {
      return Double.parseDouble(configured.get().trim());
    } catch (NumberFormatException e) {
      log.warn("Ignoring non-numeric {} '{}'", key, configured.get());
      return defaultThresholdG;
    }
  }
}
