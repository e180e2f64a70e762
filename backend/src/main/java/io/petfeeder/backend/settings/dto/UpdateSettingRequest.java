package io.petfeeder.backend.settings.dto;

import jakarta.validation.constraints.NotNull;

/** Accepts a JSON number or string; range checks depend on the key. */
public record UpdateSettingRequest(@NotNull Object value) {}
