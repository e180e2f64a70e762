package io.petfeeder.backend.device;

import io.petfeeder.backend.feed.FeedMode;
import io.petfeeder.backend.feed.FeedProperties;
import io.petfeeder.backend.schedule.ScheduleTimeCalculator;
import java.time.Clock;
import java.util.Optional;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.stereotype.Component;

/** Stand-in device for demo deployments: accepts every command and reports a fixed weight. */
@Component
@ConditionalOnProperty(name = "feeder.hardware.mode", havingValue = "simulated")
public class SimulatedHardwareAdapter implements HardwareAdapter {

  private static final Logger log = LoggerFactory.getLogger(SimulatedHardwareAdapter.class);

  static final String THING_ID = "simulated-feeder";

  private final FeedProperties feedProperties;
  private final ScheduleTimeCalculator timeCalculator;
  private final Clock clock;

  public SimulatedHardwareAdapter(
      FeedProperties feedProperties, ScheduleTimeCalculator timeCalculator, Clock clock) {
    this.feedProperties = feedProperties;
    this.timeCalculator = timeCalculator;
    this.clock = clock;
  }

  @Override
  public HardwareResponse triggerFeed(String requestedBy, FeedMode mode, int feedCycles) {
    log.info(
        "Simulated feed (requestedBy={}, mode={}, cycles={})",
        requestedBy,
        mode.value(),
        feedCycles);
    return new HardwareResponse("simulated", "Simulated feed completed");
  }

  @Override
  public Optional<DeviceStatus> getDeviceStatus() {
    return Optional.of(
        new DeviceStatus(
            THING_ID,
            "ready",
            "online",
            feedProperties.simulatedWeightG(),
            timeCalculator.format(clock.instant())));
  }
}
