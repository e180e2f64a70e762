package io.petfeeder.backend.schedule.dto;

import jakarta.validation.constraints.Max;
import jakarta.validation.constraints.Min;
import jakarta.validation.constraints.Pattern;

/** Partial update; null fields are left unchanged. */
public record UpdateScheduleRequest(
    String scheduledTime,
    @Min(1) @Max(10) Integer feedCycles,
    @Pattern(regexp = "none|daily|weekly|monthly") String recurrence,
    Boolean enabled,
    String timezone) {}
