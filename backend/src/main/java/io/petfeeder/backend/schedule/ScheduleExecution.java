package io.petfeeder.backend.schedule;

import java.util.UUID;

/**
 * One execution attempt of a schedule occurrence, as written to the execution history. Rows are
 * never updated or deleted.
 *
 * @param scheduledTime the occurrence that was attempted, not the time it was attempted at
 * @param errorMessage null for successful attempts
 */
public record ScheduleExecution(
    String executionId,
    String scheduleId,
    String scheduledTime,
    String executedAt,
    ExecutionStatus status,
    int feedCycles,
    String recurrence,
    String requestedBy,
    String errorMessage,
    String environment) {

  public static ScheduleExecution success(
      FeedSchedule schedule, String executedAt, String environment) {
    return of(schedule, executedAt, ExecutionStatus.SUCCESS, null, environment);
  }

  public static ScheduleExecution failure(
      FeedSchedule schedule, String executedAt, String errorMessage, String environment) {
    return of(schedule, executedAt, ExecutionStatus.FAILED, errorMessage, environment);
  }

  private static ScheduleExecution of(
      FeedSchedule schedule,
      String executedAt,
      ExecutionStatus status,
      String errorMessage,
      String environment) {
    return new ScheduleExecution(
        UUID.randomUUID().toString(),
        schedule.scheduleId(),
        schedule.scheduledTime(),
        executedAt,
        status,
        schedule.feedCycles(),
        schedule.recurrence(),
        schedule.requestedBy(),
        errorMessage,
        environment);
  }
}
