package io.petfeeder.backend.feed;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;

public enum FeedMode {
  MANUAL("manual"),
  API("api"),
  SCHEDULED("scheduled");

  private final String value;

  FeedMode(String value) {
    this.value = value;
  }

  @JsonValue
  public String value() {
    return value;
  }

  /**
   * @throws IllegalArgumentException for an unknown mode
   */
  @JsonCreator
  public static FeedMode fromValue(String value) {
    for (FeedMode mode : values()) {
      if (mode.value.equalsIgnoreCase(value)) {
        return mode;
      }
    }
    throw new IllegalArgumentException("Unknown feed mode: " + value);
  }

  public String eventType() {
    return this == SCHEDULED ? "scheduled_feed" : "manual_feed";
  }
}
