package io.petfeeder.backend.schedule;

import java.util.List;
import java.util.Optional;

/**
 * Table of feeding schedules keyed by schedule id. Other writers (the API, operators) may change
 * records at any time; reads are not locked and may be stale.
 *
 * <p>System-wide: selected via {@code feeder.store.provider}.
 *
 * @see ScheduleUpdate
 */
public interface ScheduleStore {

  /** All schedules with {@code enabled = true}, following every page of the scan. */
  List<FeedSchedule> scanEnabled();

  /** All schedules, optionally only those owned by {@code requestedBy}. */
  List<FeedSchedule> findAll(String requestedBy);

  Optional<FeedSchedule> findById(String scheduleId);

  /** Creates or fully replaces a schedule. */
  FeedSchedule put(FeedSchedule schedule);

  /**
   * Applies {@code update} atomically and returns the resulting record.
   *
   * @throws ScheduleConflictException if the schedule does not exist or the update's condition
   *     does not hold
   */
  FeedSchedule update(String scheduleId, ScheduleUpdate update);

  void delete(String scheduleId);
}
