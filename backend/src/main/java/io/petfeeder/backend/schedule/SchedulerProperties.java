package io.petfeeder.backend.schedule;

import org.springframework.boot.context.properties.ConfigurationProperties;

/**
 * Settings for the schedule executor.
 *
 * @param enabled whether the periodic trigger runs in this instance
 * @param intervalMs delay between the end of one run and the start of the next
 * @param toleranceMinutes an occurrence fired within this many minutes counts as on time; later
 *     firings are logged as catch-ups
 * @param maxOverdueMinutes occurrences older than this are abandoned rather than fired late
 */
@ConfigurationProperties(prefix = "feeder.scheduler")
public record SchedulerProperties(
    boolean enabled, long intervalMs, int toleranceMinutes, int maxOverdueMinutes) {

  public SchedulerProperties {
    if (toleranceMinutes < 0 || maxOverdueMinutes < 0) {
      throw new IllegalArgumentException("Scheduler windows must not be negative");
    }
  }
}
