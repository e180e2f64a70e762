package io.petfeeder.backend.schedule.dto;

import io.petfeeder.backend.schedule.FeedSchedule;

public record ScheduleResponse(
    String scheduleId,
    String requestedBy,
    String scheduledTime,
    int feedCycles,
    String recurrence,
    boolean enabled,
    String timezone,
    String lastExecutedAt,
    String createdAt,
    String updatedAt,
    String nextExecution) {

  public static ScheduleResponse from(FeedSchedule schedule) {
    return new ScheduleResponse(
        schedule.scheduleId(),
        schedule.requestedBy(),
        schedule.scheduledTime(),
        schedule.feedCycles(),
        schedule.recurrence(),
        schedule.enabled(),
        schedule.timezone(),
        schedule.lastExecutedAt(),
        schedule.createdAt(),
        schedule.updatedAt(),
        schedule.enabled() ? schedule.scheduledTime() : null);
  }
}
