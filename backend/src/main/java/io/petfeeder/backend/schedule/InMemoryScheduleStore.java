package io.petfeeder.backend.schedule;

import java.util.Comparator;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.stereotype.Component;

/** Process-local {@link ScheduleStore} for local runs and tests. */
@Component
@ConditionalOnProperty(name = "feeder.store.provider", havingValue = "memory")
public class InMemoryScheduleStore implements ScheduleStore {

  private final Map<String, FeedSchedule> schedules = new ConcurrentHashMap<>();

  @Override
  public List<FeedSchedule> scanEnabled() {
    return schedules.values().stream()
        .filter(FeedSchedule::enabled)
        .sorted(Comparator.comparing(FeedSchedule::scheduleId))
        .toList();
  }

  @Override
  public List<FeedSchedule> findAll(String requestedBy) {
    return schedules.values().stream()
        .filter(s -> requestedBy == null || requestedBy.equals(s.requestedBy()))
        .toList();
  }

  @Override
  public Optional<FeedSchedule> findById(String scheduleId) {
    return Optional.ofNullable(schedules.get(scheduleId));
  }

  @Override
  public FeedSchedule put(FeedSchedule schedule) {
    schedules.put(schedule.scheduleId(), schedule);
    return schedule;
  }

  @Override
  public FeedSchedule update(String scheduleId, ScheduleUpdate update) {
    FeedSchedule updated =
        schedules.computeIfPresent(
            scheduleId,
            (id, current) -> {
              if (!update.isSatisfiedBy(current)) {
                throw new ScheduleConflictException(scheduleId);
              }
              return update.applyTo(current);
            });
    if (updated == null) {
      throw new ScheduleConflictException(scheduleId);
    }
    return updated;
  }

  @Override
  public void delete(String scheduleId) {
    schedules.remove(scheduleId);
  }
}
