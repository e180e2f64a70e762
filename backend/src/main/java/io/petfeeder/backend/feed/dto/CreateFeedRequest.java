package io.petfeeder.backend.feed.dto;

import jakarta.validation.constraints.Max;
import jakarta.validation.constraints.Min;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.Pattern;

public record CreateFeedRequest(
    @NotBlank String requestedBy,
    @Pattern(regexp = "manual|api") String mode,
    @Min(1) @Max(10) Integer feedCycles) {}
