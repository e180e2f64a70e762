package io.petfeeder.backend.device;

import io.petfeeder.backend.feed.FeedMode;
import java.util.Optional;

/**
 * Command channel to the feeder. Selected via {@code feeder.hardware.mode}: {@code iot} publishes
 * to the real device, {@code simulated} answers locally for demos and tests.
 */
public interface HardwareAdapter {

  /**
   * Asks the device to dispense.
   *
   * @throws DeviceCommandException if the command could not be sent
   */
  HardwareResponse triggerFeed(String requestedBy, FeedMode mode, int feedCycles);

  /** Empty if the device has never reported. */
  Optional<DeviceStatus> getDeviceStatus();
}
