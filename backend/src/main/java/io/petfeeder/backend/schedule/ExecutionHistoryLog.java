package io.petfeeder.backend.schedule;

import java.util.List;

/** Append-only audit log of schedule execution attempts. */
public interface ExecutionHistoryLog {

  /**
   * @throws io.petfeeder.backend.exception.StoreException if the row could not be written
   */
  void append(ScheduleExecution execution);

  /** The most recent executions of one schedule, newest first. */
  List<ScheduleExecution> findBySchedule(String scheduleId, int limit);
}
