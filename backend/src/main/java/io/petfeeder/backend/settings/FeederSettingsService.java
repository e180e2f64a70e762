package io.petfeeder.backend.settings;

import io.petfeeder.backend.exception.InvalidStateException;
import io.petfeeder.backend.exception.ResourceNotFoundException;
import io.petfeeder.backend.feed.FeedProperties;
import io.petfeeder.backend.feed.WeightSafetyGate;
import java.math.BigInteger;
import java.util.Locale;
import java.util.Map;
import java.util.Optional;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

/**
 * Device settings kept in the config table. Keys are case-insensitive and stored upper-case. The
 * firmware-facing keys have defaults and integer ranges; any other key is stored as given.
 */
@Service
public class FeederSettingsService {

  private static final Logger log = LoggerFactory.getLogger(FeederSettingsService.class);

  static final int DEFAULT_HOLD_DURATION_MS = 3000;
  static final String DEFAULT_EMAIL_NOTIFICATIONS =
      "{\"email\":\"\",\"enabled\":false,\"subscription_arn\":\"\","
          + "\"preferences\":{\"pet_ate\":false,\"feedings\":true,\"failures\":true}}";

  private static final Map<String, IntegerRange> RANGES =
      Map.of(
          FeederSettingsStore.SERVO_OPEN_HOLD_DURATION_MS,
          new IntegerRange("Duration", 1000, 5000, " ms"),
          FeederSettingsStore.WEIGHT_THRESHOLD_G,
          new IntegerRange("Weight threshold", 100, 1000, "g"));

  private final FeederSettingsStore settingsStore;
  private final WeightSafetyGate weightSafetyGate;
  private final FeedProperties feedProperties;

  public FeederSettingsService(
      FeederSettingsStore settingsStore,
      WeightSafetyGate weightSafetyGate,
      FeedProperties feedProperties) {
    this.settingsStore = settingsStore;
    this.weightSafetyGate = weightSafetyGate;
    this.feedProperties = feedProperties;
  }

  public FeederSetting get(String key) {
    String configKey = normalize(key);
    Optional<String> stored = settingsStore.findValue(configKey);
    if (stored.isPresent()) {
      return new FeederSetting(configKey, fromStored(stored.get()));
    }
    Object fallback = defaultValue(configKey);
    if (fallback == null) {
      throw ResourceNotFoundException.withDetail(
          "Setting not found",
          "Configuration key '" + key + "' not found and has no default value.");
    }
    return new FeederSetting(configKey, fallback);
  }

  public FeederSetting update(String key, Object value) {
    String configKey = normalize(key);
    Object toStore = value;
    IntegerRange range = RANGES.get(configKey);
    if (range != null) {
      int parsed = parseInteger(value);
      if (parsed < range.min() || parsed > range.max()) {
        throw new InvalidStateException("Invalid setting value", range.outOfRangeMessage());
      }
      toStore = parsed;
    } else if (!(value instanceof String || value instanceof Number)) {
      throw new InvalidStateException(
          "Invalid setting value", "Value must be a string or a number.");
    }
    settingsStore.save(configKey, toStore);
    if (FeederSettingsStore.WEIGHT_THRESHOLD_G.equals(configKey)) {
      weightSafetyGate.evictThreshold();
    }
    log.info("Setting {} updated to {}", configKey, toStore);
    return new FeederSetting(configKey, toStore);
  }

  private Object defaultValue(String configKey) {
    return switch (configKey) {
      case FeederSettingsStore.SERVO_OPEN_HOLD_DURATION_MS -> DEFAULT_HOLD_DURATION_MS;
      case FeederSettingsStore.WEIGHT_THRESHOLD_G ->
          (int) Math.round(feedProperties.defaultWeightThresholdG());
      case FeederSettingsStore.EMAIL_NOTIFICATIONS -> DEFAULT_EMAIL_NOTIFICATIONS;
      default -> null;
    };
  }

  private static String normalize(String key) {
    return key.trim().toUpperCase(Locale.ROOT);
  }

  /** Whole numbers come back as numbers, whatever the attribute type they were stored with. */
  private static Object fromStored(String stored) {
    try {
      return Integer.valueOf(stored.trim());
    } catch (NumberFormatException e) {
      return stored;
    }
  }

  /** Accepts JSON integers and numeric strings; fractions, booleans and objects are rejected. */
  private static int parseInteger(Object value) {
    boolean integral =
        value instanceof String
            || value instanceof Integer
            || value instanceof Long
            || value instanceof BigInteger;
    if (integral) {
      try {
        return Integer.parseInt(value.toString().trim());
      } catch (NumberFormatException e) {
        throw invalidInteger();
      }
    }
    throw invalidInteger();
  }

  private static InvalidStateException invalidInteger() {
    return new InvalidStateException("Invalid setting value", "Value must be a valid integer.");
  }

  private record IntegerRange(String label, int min, int max, String unit) {

    String outOfRangeMessage() {
      return label + " must be between " + min + unit + " and " + max + unit + ".";
    }
  }
}
