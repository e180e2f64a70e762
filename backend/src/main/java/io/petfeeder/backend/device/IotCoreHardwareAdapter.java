package io.petfeeder.backend.device;

import com.fasterxml.jackson.annotation.JsonProperty;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import io.petfeeder.backend.config.IotConfig.IotProperties;
import io.petfeeder.backend.feed.FeedMode;
import io.petfeeder.backend.schedule.ScheduleTimeCalculator;
import java.time.Clock;
import java.util.Optional;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.stereotype.Component;
import software.amazon.awssdk.core.SdkBytes;
import software.amazon.awssdk.core.exception.SdkException;
import software.amazon.awssdk.services.iotdataplane.IotDataPlaneClient;
import software.amazon.awssdk.services.iotdataplane.model.PublishRequest;

/**
 * Publishes feed commands to the device through the AWS IoT data plane. Delivery is QoS 1, so the
 * device may see a command more than once. Status is not queried from the device; it is read from
 * the table the device-status rule keeps current.
 */
@Component
@ConditionalOnProperty(name = "feeder.hardware.mode", havingValue = "iot", matchIfMissing = true)
public class IotCoreHardwareAdapter implements HardwareAdapter {

  private static final Logger log = LoggerFactory.getLogger(IotCoreHardwareAdapter.class);

  static final String FEED_NOW = "FEED_NOW";

  private final IotDataPlaneClient iotClient;
  private final IotProperties properties;
  private final DeviceStatusRepository deviceStatusRepository;
  private final ObjectMapper objectMapper;
  private final ScheduleTimeCalculator timeCalculator;
  private final Clock clock;

  public IotCoreHardwareAdapter(
      IotDataPlaneClient iotClient,
      IotProperties properties,
      DeviceStatusRepository deviceStatusRepository,
      ObjectMapper objectMapper,
      ScheduleTimeCalculator timeCalculator,
      Clock clock) {
    this.iotClient = iotClient;
    this.properties = properties;
    this.deviceStatusRepository = deviceStatusRepository;
    this.objectMapper = objectMapper;
    this.timeCalculator = timeCalculator;
    this.clock = clock;
  }

  @Override
  public HardwareResponse triggerFeed(String requestedBy, FeedMode mode, int feedCycles) {
    String timestamp = timeCalculator.format(clock.instant());
    var command = new FeedCommand(FEED_NOW, requestedBy, mode.value(), feedCycles, timestamp);
    try {
      iotClient.publish(
          PublishRequest.builder()
              .topic(properties.commandTopic())
              .qos(1)
              .payload(SdkBytes.fromUtf8String(objectMapper.writeValueAsString(command)))
              .build());
    } catch (JsonProcessingException | SdkException e) {
      throw new DeviceCommandException("Failed to publish feed command", e);
    }
    log.info(
        "Published {} to {} (requestedBy={}, mode={}, cycles={})",
        FEED_NOW,
        properties.commandTopic(),
        requestedBy,
        mode.value(),
        feedCycles);
    return new HardwareResponse("sent", "Feed command sent to device");
  }

  @Override
  public Optional<DeviceStatus> getDeviceStatus() {
    return deviceStatusRepository.findByThingId(properties.thingId());
  }

  /** Wire form of the command; field names are fixed by the device firmware. */
  record FeedCommand(
      @JsonProperty("command") String command,
      @JsonProperty("requested_by") String requestedBy,
      @JsonProperty("mode") String mode,
      @JsonProperty("feed_cycles") int feedCycles,
      @JsonProperty("timestamp") String timestamp) {}
}
