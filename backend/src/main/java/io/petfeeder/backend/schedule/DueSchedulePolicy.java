package io.petfeeder.backend.schedule;

import java.time.Duration;
import java.time.Instant;
import java.time.format.DateTimeParseException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

/**
 * Decides whether a schedule's stored occurrence should fire now.
 *
 * <p>The window is {@code 0 <= now - scheduledTime <= maxOverdueMinutes}. The upper bound is the
 * overdue ceiling: an occurrence missed for longer (scheduler outage, device offline) is abandoned
 * instead of fired late. A schedule is never fired before its time. {@code toleranceMinutes} does
 * not widen or narrow the window; it only separates on-time firings from catch-ups. Setting {@code
 * maxOverdueMinutes} to 1 gives the strict, no-catch-up policy.
 */
@Component
public class DueSchedulePolicy {

  private static final Logger log = LoggerFactory.getLogger(DueSchedulePolicy.class);

  public enum DueStatus {
    NOT_YET_DUE,
    ON_TIME,
    CATCH_UP,
    EXPIRED,
    INVALID;

    public boolean isDue() {
      return this == ON_TIME || this == CATCH_UP;
    }
  }

  private final ScheduleTimeCalculator timeCalculator;
  private final int toleranceMinutes;
  private final int maxOverdueMinutes;

  public DueSchedulePolicy(ScheduleTimeCalculator timeCalculator, SchedulerProperties properties) {
    this.timeCalculator = timeCalculator;
    this.toleranceMinutes = properties.toleranceMinutes();
    this.maxOverdueMinutes = properties.maxOverdueMinutes();
  }

  public DueStatus evaluate(String scheduledTimeUtc, Instant now) {
    return evaluate(scheduledTimeUtc, now, toleranceMinutes, maxOverdueMinutes);
  }

  public boolean isScheduleDue(String scheduledTimeUtc, Instant now) {
    return evaluate(scheduledTimeUtc, now).isDue();
  }

  /** Never throws: an unparseable time is {@link DueStatus#INVALID}, which is not due. */
  public DueStatus evaluate(
      String scheduledTimeUtc, Instant now, int toleranceMinutes, int maxOverdueMinutes) {
    Instant scheduled;
    try {
      scheduled = timeCalculator.parseUtc(scheduledTimeUtc);
    } catch (DateTimeParseException e) {
      log.warn("Error parsing schedule time '{}': {}", scheduledTimeUtc, e.getMessage());
      return DueStatus.INVALID;
    }

    long deltaMillis = Duration.between(scheduled, now).toMillis();
    if (deltaMillis < 0) {
      return DueStatus.NOT_YET_DUE;
    }
    if (deltaMillis > Duration.ofMinutes(maxOverdueMinutes).toMillis()) {
      return DueStatus.EXPIRED;
    }
    if (deltaMillis <= Duration.ofMinutes(toleranceMinutes).toMillis()) {
      return DueStatus.ON_TIME;
    }
    return DueStatus.CATCH_UP;
  }
}
