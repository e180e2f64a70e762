package io.petfeeder.backend.schedule;

/** What one executor run did with one schedule. */
public enum ScheduleOutcome {
  /** Not inside the due window: in the future, past the overdue ceiling, or unparseable. */
  NOT_DUE,
  /** Due, but {@code lastExecutedAt} shows this occurrence already fired. */
  DUE_ALREADY_FIRED,
  TRIGGER_FAILED,
  /** Fed and recorded; the only outcome that counts as executed. */
  SCHEDULE_UPDATED,
  /** Fed, but the schedule could not be advanced; the occurrence may fire again. */
  SCHEDULE_UPDATE_FAILED,
  /** Unexpected error while processing the schedule. */
  ERROR;

  public boolean isFailure() {
    return this == TRIGGER_FAILED || this == SCHEDULE_UPDATE_FAILED || this == ERROR;
  }

  public boolean isSkipped() {
    return this == NOT_DUE || this == DUE_ALREADY_FIRED;
  }
}
