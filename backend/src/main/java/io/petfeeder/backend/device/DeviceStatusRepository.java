package io.petfeeder.backend.device;

import java.util.Optional;

public interface DeviceStatusRepository {

  Optional<DeviceStatus> findByThingId(String thingId);
}
