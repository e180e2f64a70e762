package io.petfeeder.backend.schedule;

import io.petfeeder.backend.exception.StoreException;

/**
 * A conditional schedule update was rejected: the record no longer exists, or it no longer holds
 * the occurrence the caller expected.
 */
public class ScheduleConflictException extends StoreException {

  public ScheduleConflictException(String scheduleId, Throwable cause) {
    super("Conditional update rejected for schedule " + scheduleId, cause);
  }

  public ScheduleConflictException(String scheduleId) {
    super("Conditional update rejected for schedule " + scheduleId);
  }
}
