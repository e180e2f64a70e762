package io.petfeeder.backend.feed;

import io.petfeeder.backend.device.HardwareAdapter;
import io.petfeeder.backend.device.HardwareResponse;
import io.petfeeder.backend.schedule.ScheduleTimeCalculator;
import java.time.Clock;
import java.util.List;
import java.util.UUID;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

/**
 * Processes feed requests from every source (manual, API, schedules): weight gate, then the device
 * command, then the feed event. Device failures never escape as exceptions.
 */
@Service
public class FeedService implements FeedTriggerGateway {

  private static final Logger log = LoggerFactory.getLogger(FeedService.class);

  private final WeightSafetyGate weightSafetyGate;
  private final HardwareAdapter hardwareAdapter;
  private final FeedEventLog feedEventLog;
  private final ScheduleTimeCalculator timeCalculator;
  private final Clock clock;

  public FeedService(
      WeightSafetyGate weightSafetyGate,
      HardwareAdapter hardwareAdapter,
      FeedEventLog feedEventLog,
      ScheduleTimeCalculator timeCalculator,
      Clock clock) {
    this.weightSafetyGate = weightSafetyGate;
    this.hardwareAdapter = hardwareAdapter;
    this.feedEventLog = feedEventLog;
    this.timeCalculator = timeCalculator;
    this.clock = clock;
  }

  @Override
  public FeedResult trigger(FeedRequest request) {
    String feedId = UUID.randomUUID().toString();
    String timestamp = timeCalculator.format(clock.instant());

    FeedStatus status;
    if (!weightSafetyGate.check().allowed()) {
      status = FeedStatus.DENIED_WEIGHT_EXCEEDED;
    } else {
      status = sendCommand(request);
    }

    var result =
        new FeedResult(
            feedId,
            request.requestedBy(),
            request.mode(),
            status,
            timestamp,
            request.mode().eventType(),
            request.feedCycles(),
            request.scheduleId());
    recordEvent(result);
    log.info(
        "Feed {} processed: mode={}, requestedBy={}, status={}",
        feedId,
        request.mode().value(),
        request.requestedBy(),
        status.value());
    return result;
  }

  public List<FeedResult> recentFeeds(int limit) {
    return feedEventLog.findRecent(limit);
  }

  private FeedStatus sendCommand(FeedRequest request) {
    try {
      HardwareResponse response =
          hardwareAdapter.triggerFeed(request.requestedBy(), request.mode(), request.feedCycles());
      return FeedStatus.fromValue(response.status()).isSuccessful()
          ? FeedStatus.SENT
          : FeedStatus.FAILED;
    } catch (RuntimeException e) {
      log.error("Feed command failed for {}", request.requestedBy(), e);
      return FeedStatus.FAILED;
    }
  }

  private void recordEvent(FeedResult result) {
    try {
      feedEventLog.append(result);
    } catch (RuntimeException e) {
      log.warn("Failed to record feed event {}: {}", result.feedId(), e.getMessage());
    }
  }
}
