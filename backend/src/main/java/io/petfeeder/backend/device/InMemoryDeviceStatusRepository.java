package io.petfeeder.backend.device;

import java.util.Map;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.stereotype.Component;

@Component
@ConditionalOnProperty(name = "feeder.store.provider", havingValue = "memory")
public class InMemoryDeviceStatusRepository implements DeviceStatusRepository {

  private final Map<String, DeviceStatus> statuses = new ConcurrentHashMap<>();

  @Override
  public Optional<DeviceStatus> findByThingId(String thingId) {
    return Optional.ofNullable(statuses.get(thingId));
  }

  public void save(DeviceStatus status) {
    statuses.put(status.thingId(), status);
  }
}
