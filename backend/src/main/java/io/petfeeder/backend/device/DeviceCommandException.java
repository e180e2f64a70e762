package io.petfeeder.backend.device;

/** A command could not be delivered to the device channel. */
public class DeviceCommandException extends RuntimeException {

  public DeviceCommandException(String message, Throwable cause) {
    super(message, cause);
  }
}
