package io.petfeeder.backend.schedule;

/**
 * Counts for one executor run. {@code executed + failed + skipped == totalSchedules}.
 *
 * @param timestamp the run's reference time
 */
public record ExecutionSummary(
    int totalSchedules, int executed, int failed, int skipped, String timestamp) {}
