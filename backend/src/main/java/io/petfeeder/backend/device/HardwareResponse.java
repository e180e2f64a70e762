package io.petfeeder.backend.device;

/**
 * @param status {@code sent}, {@code simulated} or {@code completed} when the command was accepted
 */
public record HardwareResponse(String status, String message) {}
