package io.petfeeder.backend.schedule;

import com.fasterxml.jackson.annotation.JsonValue;

public enum ExecutionStatus {
  SUCCESS("success"),
  FAILED("failed");

  private final String value;

  ExecutionStatus(String value) {
    this.value = value;
  }

  @JsonValue
  public String value() {
    return value;
  }

  public static ExecutionStatus fromValue(String value) {
    return "success".equals(value) ? SUCCESS : FAILED;
  }
}
