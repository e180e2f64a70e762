package io.petfeeder.backend.schedule;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.scheduling.annotation.Scheduled;
import org.springframework.stereotype.Component;

/**
 * In-process periodic trigger for {@link ScheduleExecutor}. Uses a fixed delay, so runs from this
 * job never overlap; overlap with on-demand runs through {@link SchedulerController} is possible
 * and tolerated.
 */
@Component
@ConditionalOnProperty(name = "feeder.scheduler.enabled", havingValue = "true")
public class ScheduleExecutorJob {

  private static final Logger log = LoggerFactory.getLogger(ScheduleExecutorJob.class);

  private final ScheduleExecutor scheduleExecutor;

  public ScheduleExecutorJob(ScheduleExecutor scheduleExecutor) {
    this.scheduleExecutor = scheduleExecutor;
  }

  @Scheduled(
      fixedDelayString = "${feeder.scheduler.interval-ms:60000}",
      initialDelayString = "${feeder.scheduler.interval-ms:60000}")
  public void executeSchedules() {
    var result = scheduleExecutor.run();
    if (!result.isSuccessful()) {
      log.error("Scheduled executor run failed: {}", result.body());
    }
  }
}
