package io.petfeeder.backend.schedule.dto;

import jakarta.validation.constraints.Max;
import jakarta.validation.constraints.Min;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.Pattern;

/**
 * @param scheduledTime ISO 8601; read in {@code timezone} unless it carries its own zone designator
 */
public record CreateScheduleRequest(
    @NotBlank String requestedBy,
    @NotBlank String scheduledTime,
    @Min(1) @Max(10) Integer feedCycles,
    @Pattern(regexp = "none|daily|weekly|monthly") String recurrence,
    Boolean enabled,
    String timezone) {}
