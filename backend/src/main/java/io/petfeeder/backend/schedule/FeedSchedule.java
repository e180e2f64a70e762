package io.petfeeder.backend.schedule;

/**
 * A feeding schedule as held in the schedule table.
 *
 * <p>Timestamps are kept as the stored strings: the table can be edited by other writers, so a
 * malformed value must survive a read and be dealt with where it is interpreted. {@code
 * scheduledTime} is always UTC; {@code timezone} only records how the user's input was read.
 *
 * @param lastExecutedAt the {@code scheduledTime} of the occurrence that most recently fired, or
 *     null if the current occurrence has never fired
 */
public record FeedSchedule(
    String scheduleId,
    String requestedBy,
    String scheduledTime,
    int feedCycles,
    String recurrence,
    boolean enabled,
    String timezone,
    String lastExecutedAt,
    String createdAt,
    String updatedAt) {

  public Recurrence recurrenceType() {
    return Recurrence.fromValue(recurrence);
  }

  /** True if the occurrence currently in {@code scheduledTime} has already fired. */
  public boolean hasFiredCurrentOccurrence() {
    return lastExecutedAt != null && lastExecutedAt.equals(scheduledTime);
  }
}
