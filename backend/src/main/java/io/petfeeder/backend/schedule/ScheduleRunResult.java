package io.petfeeder.backend.schedule;

import com.fasterxml.jackson.annotation.JsonProperty;

/**
 * Result of one executor invocation in the shape returned to the external trigger: 200 with an
 * {@link ExecutionSummary}, or 500 with an error message when the schedules could not be read.
 * The envelope key stays {@code statusCode} under the snake_case naming strategy.
 */
public record ScheduleRunResult(@JsonProperty("statusCode") int statusCode, Object body) {

  public static ScheduleRunResult ok(ExecutionSummary summary) {
    return new ScheduleRunResult(200, summary);
  }

  public static ScheduleRunResult error(String message) {
    return new ScheduleRunResult(500, message);
  }

  public boolean isSuccessful() {
    return statusCode == 200;
  }
}
