package io.petfeeder.backend.device;

/**
 * Latest reported state of the feeder, as written by the device-status rule.
 *
 * @param currentWeightG bowl weight in grams, or null if the device has not reported one
 */
public record DeviceStatus(
    String thingId,
    String status,
    String networkStatus,
    Double currentWeightG,
    String lastUpdated) {}
