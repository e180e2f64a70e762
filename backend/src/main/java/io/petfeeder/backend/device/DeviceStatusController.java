package io.petfeeder.backend.device;

import io.petfeeder.backend.exception.ResourceNotFoundException;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

/** Latest status the feeder reported; 404 until it has reported at least once. */
@RestController
@RequestMapping("/api/status")
public class DeviceStatusController {

  private final HardwareAdapter hardwareAdapter;

  public DeviceStatusController(HardwareAdapter hardwareAdapter) {
    this.hardwareAdapter = hardwareAdapter;
  }

  @GetMapping
  public ResponseEntity<DeviceStatus> getStatus() {
    return hardwareAdapter
        .getDeviceStatus()
        .map(ResponseEntity::ok)
        .orElseThrow(
            () ->
                ResourceNotFoundException.withDetail(
                    "Device status not found", "The feeder has not reported its status yet."));
  }
}
