package io.petfeeder.backend.feed;

import com.fasterxml.jackson.annotation.JsonValue;

/**
 * Outcome of a feed request. The device channel reports {@code sent}, {@code simulated} or {@code
 * completed} for an accepted command; every other value counts as {@link #FAILED}.
 */
public enum FeedStatus {
  SENT("sent"),
  SIMULATED("simulated"),
  COMPLETED("completed"),
  FAILED("failed"),
  DENIED_WEIGHT_EXCEEDED("denied_weight_exceeded");

  private final String value;

  FeedStatus(String value) {
    this.value = value;
  }

  @JsonValue
  public String value() {
    return value;
  }

  public boolean isSuccessful() {
    return this == SENT || this == SIMULATED || this == COMPLETED;
  }

  public static FeedStatus fromValue(String value) {
    for (FeedStatus status : values()) {
      if (status.value.equals(value)) {
        return status;
      }
    }
    return FAILED;
  }
}
