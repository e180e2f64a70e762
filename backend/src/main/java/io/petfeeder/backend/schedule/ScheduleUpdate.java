package io.petfeeder.backend.schedule;

import java.util.Objects;

/**
 * A set of attribute changes applied to one schedule in a single conditional write. Null fields
 * are left untouched.
 *
 * <p>{@link Builder#onlyIfUnfired(String)} adds the occurrence guard: the write is rejected unless
 * the stored {@code scheduledTime} still equals the given occurrence and {@code lastExecutedAt}
 * does not. Two executor runs that both fired the same occurrence therefore cannot both record it.
 */
public final class ScheduleUpdate {

  private final String scheduledTime;
  private final Integer feedCycles;
  private final String recurrence;
  private final Boolean enabled;
  private final String timezone;
  private final String lastExecutedAt;
  private final boolean clearLastExecutedAt;
  private final String updatedAt;
  private final String unfiredOccurrence;

  private ScheduleUpdate(Builder builder) {
    this.scheduledTime = builder.scheduledTime;
    this.feedCycles = builder.feedCycles;
    this.recurrence = builder.recurrence;
    this.enabled = builder.enabled;
    this.timezone = builder.timezone;
    this.lastExecutedAt = builder.lastExecutedAt;
    this.clearLastExecutedAt = builder.clearLastExecutedAt;
    this.updatedAt = builder.updatedAt;
    this.unfiredOccurrence = builder.unfiredOccurrence;
  }

  public static Builder builder() {
    return new Builder();
  }

  public String scheduledTime() {
    return scheduledTime;
  }

  public Integer feedCycles() {
    return feedCycles;
  }

  public String recurrence() {
    return recurrence;
  }

  public Boolean enabled() {
    return enabled;
  }

  public String timezone() {
    return timezone;
  }

  public String lastExecutedAt() {
    return lastExecutedAt;
  }

  public boolean clearLastExecutedAt() {
    return clearLastExecutedAt;
  }

  public String updatedAt() {
    return updatedAt;
  }

  /** The occurrence that must still be pending for the write to apply, or null. */
  public String unfiredOccurrence() {
    return unfiredOccurrence;
  }

  /** Evaluates the write condition against a current record. */
  public boolean isSatisfiedBy(FeedSchedule current) {
    if (unfiredOccurrence == null) {
      return true;
    }
    return unfiredOccurrence.equals(current.scheduledTime())
        && !Objects.equals(unfiredOccurrence, current.lastExecutedAt());
  }

  public FeedSchedule applyTo(FeedSchedule current) {
    return new FeedSchedule(
        current.scheduleId(),
        current.requestedBy(),
        scheduledTime != null ? scheduledTime : current.scheduledTime(),
        feedCycles != null ? feedCycles : current.feedCycles(),
        recurrence != null ? recurrence : current.recurrence(),
        enabled != null ? enabled : current.enabled(),
        timezone != null ? timezone : current.timezone(),
        clearLastExecutedAt
            ? null
            : lastExecutedAt != null ? lastExecutedAt : current.lastExecutedAt(),
        current.createdAt(),
        updatedAt != null ? updatedAt : current.updatedAt());
  }

  public static final class Builder {

    private String scheduledTime;
    private Integer feedCycles;
    private String recurrence;
    private Boolean enabled;
    private String timezone;
    private String lastExecutedAt;
    private boolean clearLastExecutedAt;
    private String updatedAt;
    private String unfiredOccurrence;

    private Builder() {}

    public Builder scheduledTime(String scheduledTime) {
      this.scheduledTime = scheduledTime;
      return this;
    }

    public Builder feedCycles(Integer feedCycles) {
      this.feedCycles = feedCycles;
      return this;
    }

    public Builder recurrence(String recurrence) {
      this.recurrence = recurrence;
      return this;
    }

    public Builder enabled(Boolean enabled) {
      this.enabled = enabled;
      return this;
    }

    public Builder timezone(String timezone) {
      this.timezone = timezone;
      return this;
    }

    public Builder lastExecutedAt(String lastExecutedAt) {
      this.lastExecutedAt = lastExecutedAt;
      this.clearLastExecutedAt = false;
      return this;
    }

    public Builder clearLastExecutedAt() {
      this.lastExecutedAt = null;
      this.clearLastExecutedAt = true;
      return this;
    }

    public Builder updatedAt(String updatedAt) {
      this.updatedAt = updatedAt;
      return this;
    }

    public Builder onlyIfUnfired(String occurrence) {
      this.unfiredOccurrence = occurrence;
      return this;
    }

    public ScheduleUpdate build() {
      return new ScheduleUpdate(this);
    }
  }
}
