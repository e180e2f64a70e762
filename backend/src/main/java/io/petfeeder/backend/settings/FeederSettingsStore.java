package io.petfeeder.backend.settings;

import java.util.Optional;

/** Operator-managed key/value settings, e.g. {@code WEIGHT_THRESHOLD_G}. */
public interface FeederSettingsStore {

  String WEIGHT_THRESHOLD_G = "WEIGHT_THRESHOLD_G";
  String SERVO_OPEN_HOLD_DURATION_MS = "SERVO_OPEN_HOLD_DURATION_MS";
  String EMAIL_NOTIFICATIONS = "EMAIL_NOTIFICATIONS";

  /**
   * @throws io.petfeeder.backend.exception.StoreException if the settings table cannot be read
   */
  Optional<String> findValue(String key);

  /**
   * Creates or replaces a setting. Numbers are stored as numbers, anything else as its string
   * form.
   *
   * @throws io.petfeeder.backend.exception.StoreException if the settings table cannot be written
   */
  void save(String key, Object value);
}
