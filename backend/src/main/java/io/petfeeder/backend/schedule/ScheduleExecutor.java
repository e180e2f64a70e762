package io.petfeeder.backend.schedule;

import io.petfeeder.backend.config.FeederProperties;
import io.petfeeder.backend.exception.StoreException;
import io.petfeeder.backend.feed.FeedRequest;
import io.petfeeder.backend.feed.FeedResult;
import io.petfeeder.backend.feed.FeedTriggerGateway;
import io.petfeeder.backend.schedule.DueSchedulePolicy.DueStatus;
import java.time.Clock;
import java.time.Instant;
import java.util.EnumMap;
import java.util.List;
import java.util.Map;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

/**
 * Fires due feeding schedules. Every run starts cold from the schedule table: the executor keeps no
 * state between runs, so any run may be repeated, overlapped or restarted.
 *
 * <p>Per schedule: due check, then the idempotency guard ({@code lastExecutedAt == scheduledTime}
 * means this occurrence already fired), then the feed, then one conditional write that marks the
 * occurrence fired and either advances a recurring schedule or disables a one-time one. A failed
 * feed leaves the schedule untouched so it is retried on the next run, within the overdue ceiling.
 *
 * <p>The conditional write only succeeds if the stored occurrence is still unfired. Two overlapping
 * runs can both pass the guard and both feed, but only one of them records the occurrence; the
 * other logs a failed execution.
 */
@Service
public class ScheduleExecutor {

  private static final Logger log = LoggerFactory.getLogger(ScheduleExecutor.class);

  private final ScheduleStore scheduleStore;
  private final ExecutionHistoryLog historyLog;
  private final FeedTriggerGateway feedGateway;
  private final DueSchedulePolicy duePolicy;
  private final ScheduleTimeCalculator timeCalculator;
  private final Clock clock;
  private final String environment;

  public ScheduleExecutor(
      ScheduleStore scheduleStore,
      ExecutionHistoryLog historyLog,
      FeedTriggerGateway feedGateway,
      DueSchedulePolicy duePolicy,
      ScheduleTimeCalculator timeCalculator,
      Clock clock,
      FeederProperties feederProperties) {
    this.scheduleStore = scheduleStore;
    this.historyLog = historyLog;
    this.feedGateway = feedGateway;
    this.duePolicy = duePolicy;
    this.timeCalculator = timeCalculator;
    this.clock = clock;
    this.environment = feederProperties.environment();
  }

  public ScheduleRunResult run() {
    Instant now = clock.instant();
    String timestamp = timeCalculator.format(now);
    log.info("Schedule executor run started at {}", timestamp);

    List<FeedSchedule> schedules;
    try {
      schedules = scheduleStore.scanEnabled();
    } catch (StoreException e) {
      log.error("Failed to scan enabled schedules", e);
      return ScheduleRunResult.error("Schedule store error: " + e.getMessage());
    } catch (RuntimeException e) {
      log.error("Unexpected error scanning schedules", e);
      return ScheduleRunResult.error("Internal server error: " + e.getMessage());
    }
    log.info("Found {} enabled schedule(s)", schedules.size());

    Map<ScheduleOutcome, Integer> counts = new EnumMap<>(ScheduleOutcome.class);
    for (FeedSchedule schedule : schedules) {
      ScheduleOutcome outcome;
      try {
        outcome = process(schedule, now);
      } catch (RuntimeException e) {
        log.error("Unexpected error processing schedule {}", schedule.scheduleId(), e);
        recordFailure(schedule, "Unexpected error: " + e.getMessage());
        outcome = ScheduleOutcome.ERROR;
      }
      counts.merge(outcome, 1, Integer::sum);
    }

    var summary =
        new ExecutionSummary(
            schedules.size(),
            counts.getOrDefault(ScheduleOutcome.SCHEDULE_UPDATED, 0),
            sum(counts, true),
            sum(counts, false),
            timestamp);
    log.info(
        "Schedule executor run completed: total={}, executed={}, failed={}, skipped={}",
        summary.totalSchedules(),
        summary.executed(),
        summary.failed(),
        summary.skipped());
    return ScheduleRunResult.ok(summary);
  }

  /** Runs the per-schedule state machine against one scanned record. */
  ScheduleOutcome process(FeedSchedule schedule, Instant now) {
    String scheduleId = schedule.scheduleId();
    DueStatus dueStatus = duePolicy.evaluate(schedule.scheduledTime(), now);
    if (!dueStatus.isDue()) {
      if (dueStatus == DueStatus.EXPIRED) {
        if (schedule.recurrenceType().isRecurring()) {
          log.warn(
              "Recurring schedule {} is stuck on expired occurrence {}; it will not fire again"
                  + " until its scheduled_time is edited",
              scheduleId,
              schedule.scheduledTime());
        } else {
          log.warn(
              "Schedule {} occurrence {} is past the overdue ceiling, skipping",
              scheduleId,
              schedule.scheduledTime());
        }
      } else {
        log.debug("Schedule {} not due ({})", scheduleId, dueStatus);
      }
      return ScheduleOutcome.NOT_DUE;
    }

    if (schedule.hasFiredCurrentOccurrence()) {
      log.info(
          "Schedule {} already executed for {} (last_executed_at={})",
          scheduleId,
          schedule.scheduledTime(),
          schedule.lastExecutedAt());
      return ScheduleOutcome.DUE_ALREADY_FIRED;
    }

    if (dueStatus == DueStatus.CATCH_UP) {
      log.info("Schedule {} is overdue, catching up {}", scheduleId, schedule.scheduledTime());
    }

    String triggerError = trigger(schedule);
    if (triggerError != null) {
      recordFailure(schedule, triggerError);
      return ScheduleOutcome.TRIGGER_FAILED;
    }

    try {
      FeedSchedule updated = scheduleStore.update(scheduleId, advance(schedule, now));
      log.info(
          "Executed schedule {} occurrence {} (next={}, enabled={})",
          scheduleId,
          schedule.scheduledTime(),
          updated.scheduledTime(),
          updated.enabled());
    } catch (ScheduleConflictException e) {
      log.warn(
          "Schedule {} changed concurrently after feeding {}; occurrence not recorded",
          scheduleId,
          schedule.scheduledTime());
      recordFailure(schedule, "Schedule changed concurrently; feed sent but not recorded");
      return ScheduleOutcome.SCHEDULE_UPDATE_FAILED;
    } catch (StoreException e) {
      log.error("Executed schedule {} but failed to update it", scheduleId, e);
      recordFailure(schedule, "Failed to update schedule after execution: " + e.getMessage());
      return ScheduleOutcome.SCHEDULE_UPDATE_FAILED;
    }

    recordSuccess(schedule);
    return ScheduleOutcome.SCHEDULE_UPDATED;
  }

  /** Returns null on success, otherwise the error recorded in the history. */
  private String trigger(FeedSchedule schedule) {
    FeedResult result;
    try {
      result =
          feedGateway.trigger(
              FeedRequest.scheduled(
                  schedule.scheduleId(), schedule.feedCycles(), schedule.requestedBy()));
    } catch (RuntimeException e) {
      log.error("Feed trigger threw for schedule {}", schedule.scheduleId(), e);
      return "Failed to trigger feed: " + e.getMessage();
    }
    if (result == null || !result.isSuccessful()) {
      String status = result != null ? result.status().value() : "no result";
      log.warn("Failed to execute schedule {}: feed status {}", schedule.scheduleId(), status);
      return "Failed to trigger feed: " + status;
    }
    return null;
  }

  /** The post-feed write: {@code lastExecutedAt} takes the fired occurrence, not the next one. */
  private ScheduleUpdate advance(FeedSchedule schedule, Instant now) {
    String occurrence = schedule.scheduledTime();
    var update =
        ScheduleUpdate.builder()
            .onlyIfUnfired(occurrence)
            .lastExecutedAt(occurrence)
            .updatedAt(timeCalculator.format(now));
    Recurrence recurrence = schedule.recurrenceType();
    if (recurrence.isRecurring()) {
      update.scheduledTime(timeCalculator.calculateNextExecution(occurrence, recurrence.value()));
    } else {
      update.enabled(false);
    }
    return update.build();
  }

  private void recordSuccess(FeedSchedule schedule) {
    String executedAt = timeCalculator.format(clock.instant());
    append(ScheduleExecution.success(schedule, executedAt, environment));
  }

  private void recordFailure(FeedSchedule schedule, String errorMessage) {
    append(
        ScheduleExecution.failure(
            schedule, timeCalculator.format(clock.instant()), errorMessage, environment));
  }

  /** History is best effort: a write failure never changes the outcome of a schedule. */
  private void append(ScheduleExecution execution) {
    try {
      historyLog.append(execution);
    } catch (RuntimeException e) {
      log.warn(
          "Failed to log execution history for schedule {}: {}",
          execution.scheduleId(),
          e.getMessage());
    }
  }

  private static int sum(Map<ScheduleOutcome, Integer> counts, boolean failures) {
    return counts.entrySet().stream()
        .filter(e -> failures ? e.getKey().isFailure() : e.getKey().isSkipped())
        .mapToInt(Map.Entry::getValue)
        .sum();
  }
}
