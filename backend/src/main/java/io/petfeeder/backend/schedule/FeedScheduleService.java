package io.petfeeder.backend.schedule;

import io.petfeeder.backend.config.FeederProperties;
import io.petfeeder.backend.exception.InvalidStateException;
import io.petfeeder.backend.exception.ResourceNotFoundException;
import io.petfeeder.backend.schedule.dto.CreateScheduleRequest;
import io.petfeeder.backend.schedule.dto.ScheduleListResponse;
import io.petfeeder.backend.schedule.dto.ScheduleResponse;
import io.petfeeder.backend.schedule.dto.UpdateScheduleRequest;
import java.time.Clock;
import java.time.DateTimeException;
import java.time.Instant;
import java.util.Comparator;
import java.util.List;
import java.util.UUID;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

@Service
public class FeedScheduleService {

  private static final Logger log = LoggerFactory.getLogger(FeedScheduleService.class);

  static final int MAX_PAGE_SIZE = 100;

  private static final Comparator<FeedSchedule> NEWEST_FIRST =
      Comparator.comparing(
              FeedSchedule::createdAt, Comparator.nullsFirst(Comparator.<String>naturalOrder()))
          .reversed();

  private final ScheduleStore scheduleStore;
  private final ExecutionHistoryLog historyLog;
  private final ScheduleTimeCalculator timeCalculator;
  private final Clock clock;
  private final FeederProperties feederProperties;

  public FeedScheduleService(
      ScheduleStore scheduleStore,
      ExecutionHistoryLog historyLog,
      ScheduleTimeCalculator timeCalculator,
      Clock clock,
      FeederProperties feederProperties) {
    this.scheduleStore = scheduleStore;
    this.historyLog = historyLog;
    this.timeCalculator = timeCalculator;
    this.clock = clock;
    this.feederProperties = feederProperties;
  }

  public ScheduleResponse create(CreateScheduleRequest request) {
    String timezone = request.timezone() != null ? request.timezone() : "UTC";
    String scheduledTime = toUtc(request.scheduledTime(), timezone);
    Instant now = clock.instant();
    if (feederProperties.requireFutureTime()
        && !timeCalculator.parseUtc(scheduledTime).isAfter(now)) {
      throw new InvalidStateException(
          "Invalid schedule time", "Scheduled time " + scheduledTime + " is not in the future");
    }

    String timestamp = timeCalculator.format(now);
    var schedule =
        new FeedSchedule(
            UUID.randomUUID().toString(),
            request.requestedBy(),
            scheduledTime,
            request.feedCycles() != null ? request.feedCycles() : 1,
            request.recurrence() != null ? request.recurrence() : Recurrence.NONE.value(),
            request.enabled() == null || request.enabled(),
            timezone,
            null,
            timestamp,
            timestamp);
    scheduleStore.put(schedule);
    log.info(
        "Created schedule {} for {} at {} ({})",
        schedule.scheduleId(),
        schedule.requestedBy(),
        scheduledTime,
        schedule.recurrence());
    return ScheduleResponse.from(schedule);
  }

  public ScheduleListResponse list(int page, int pageSize, String requestedBy) {
    if (page < 1) {
      throw new InvalidStateException("Invalid page", "page must be 1 or greater");
    }
    if (pageSize < 1 || pageSize > MAX_PAGE_SIZE) {
      throw new InvalidStateException(
          "Invalid page size", "page_size must be between 1 and " + MAX_PAGE_SIZE);
    }
    List<FeedSchedule> all =
        scheduleStore.findAll(requestedBy).stream().sorted(NEWEST_FIRST).toList();
    int from = Math.min((page - 1) * pageSize, all.size());
    int to = Math.min(from + pageSize, all.size());
    var schedules = all.subList(from, to).stream().map(ScheduleResponse::from).toList();
    return new ScheduleListResponse(schedules, all.size(), page, pageSize, to < all.size());
  }

  public ScheduleResponse get(String scheduleId) {
    return ScheduleResponse.from(require(scheduleId));
  }

  /**
   * Applies a partial update. A new {@code scheduledTime} is read in the request's timezone, or the
   * schedule's own when the request has none. Moving the time starts a new occurrence, so {@code
   * lastExecutedAt} is cleared.
   */
  public ScheduleResponse update(String scheduleId, UpdateScheduleRequest request) {
    FeedSchedule existing = require(scheduleId);
    String timezone = request.timezone() != null ? request.timezone() : existing.timezone();

    var update = ScheduleUpdate.builder().updatedAt(timeCalculator.format(clock.instant()));
    if (request.timezone() != null) {
      validateTimezone(request.timezone());
      update.timezone(request.timezone());
    }
    if (request.scheduledTime() != null) {
      String scheduledTime = toUtc(request.scheduledTime(), timezone);
      if (!scheduledTime.equals(existing.scheduledTime())) {
        update.scheduledTime(scheduledTime).clearLastExecutedAt();
      }
    }
    if (request.feedCycles() != null) {
      update.feedCycles(request.feedCycles());
    }
    if (request.recurrence() != null) {
      update.recurrence(request.recurrence());
    }
    if (request.enabled() != null) {
      update.enabled(request.enabled());
    }

    FeedSchedule updated = scheduleStore.update(scheduleId, update.build());
    log.info("Updated schedule {}", scheduleId);
    return ScheduleResponse.from(updated);
  }

  public ScheduleResponse setEnabled(String scheduleId, boolean enabled) {
    require(scheduleId);
    FeedSchedule updated =
        scheduleStore.update(
            scheduleId,
            ScheduleUpdate.builder()
                .enabled(enabled)
                .updatedAt(timeCalculator.format(clock.instant()))
                .build());
    log.info("Schedule {} {}", scheduleId, enabled ? "enabled" : "disabled");
    return ScheduleResponse.from(updated);
  }

  public void delete(String scheduleId) {
    require(scheduleId);
    scheduleStore.delete(scheduleId);
    log.info("Deleted schedule {}", scheduleId);
  }

  public List<ScheduleExecution> listExecutions(String scheduleId, int limit) {
    require(scheduleId);
    return historyLog.findBySchedule(scheduleId, Math.max(1, Math.min(limit, MAX_PAGE_SIZE)));
  }

  private FeedSchedule require(String scheduleId) {
    return scheduleStore
        .findById(scheduleId)
        .orElseThrow(() -> new ResourceNotFoundException("Schedule", scheduleId));
  }

  private String toUtc(String localTime, String timezone) {
    try {
      return timeCalculator.convertToUtc(localTime, timezone);
    } catch (DateTimeException e) {
      throw new InvalidStateException(
          "Invalid schedule time",
          "Cannot read '" + localTime + "' in timezone " + timezone + ": " + e.getMessage());
    }
  }

  private void validateTimezone(String timezone) {
    try {
      timeCalculator.convertToUtc("2000-01-01T00:00:00", timezone);
    } catch (DateTimeException e) {
      throw new InvalidStateException("Invalid timezone", "Unknown timezone " + timezone);
    }
  }
}
