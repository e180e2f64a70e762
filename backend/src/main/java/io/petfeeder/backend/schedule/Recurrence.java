package io.petfeeder.backend.schedule;

/** How a schedule repeats once it has fired. Stored as its lowercase value. */
public enum Recurrence {
  NONE("none"),
  DAILY("daily"),
  WEEKLY("weekly"),
  MONTHLY("monthly");

  private final String value;

  Recurrence(String value) {
    this.value = value;
  }

  public String value() {
    return value;
  }

  public boolean isRecurring() {
    return this != NONE;
  }

  /**
   * Resolves a stored value. Records are editable outside this service, so anything unrecognised
   * (including null) resolves to {@link #NONE}.
   */
  public static Recurrence fromValue(String value) {
    if (value != null) {
      for (Recurrence recurrence : values()) {
        if (recurrence.value.equals(value)) {
          return recurrence;
        }
      }
    }
    return NONE;
  }
}
