package io.petfeeder.backend.schedule;

import java.util.Comparator;
import java.util.List;
import java.util.concurrent.CopyOnWriteArrayList;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.stereotype.Component;

@Component
@ConditionalOnProperty(name = "feeder.store.provider", havingValue = "memory")
public class InMemoryExecutionHistoryLog implements ExecutionHistoryLog {

  private final List<ScheduleExecution> executions = new CopyOnWriteArrayList<>();

  @Override
  public void append(ScheduleExecution execution) {
    executions.add(execution);
  }

  @Override
  public List<ScheduleExecution> findBySchedule(String scheduleId, int limit) {
    return executions.stream()
        .filter(e -> e.scheduleId().equals(scheduleId))
        .sorted(Comparator.comparing(ScheduleExecution::executedAt).reversed())
        .limit(limit)
        .toList();
  }
}
