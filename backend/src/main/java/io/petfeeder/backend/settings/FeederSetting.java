package io.petfeeder.backend.settings;

/**
 * One config-table entry as the API returns it.
 *
 * @param value an {@code Integer} for whole-number settings, otherwise the stored string
 */
public record FeederSetting(String configKey, Object value) {}
