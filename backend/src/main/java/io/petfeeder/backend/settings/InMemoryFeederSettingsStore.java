package io.petfeeder.backend.settings;

import java.util.Map;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.stereotype.Component;

@Component
@ConditionalOnProperty(name = "feeder.store.provider", havingValue = "memory")
public class InMemoryFeederSettingsStore implements FeederSettingsStore {

  private final Map<String, String> settings = new ConcurrentHashMap<>();

  @Override
  public Optional<String> findValue(String key) {
    return Optional.ofNullable(settings.get(key));
  }

  @Override
  public void save(String key, Object value) {
    settings.put(key, String.valueOf(value));
  }

  public void put(String key, String value) {
    settings.put(key, value);
  }

  public void clear() {
    settings.clear();
  }
}
