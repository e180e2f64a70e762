package io.petfeeder.backend.feed;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyInt;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.Mockito.doThrow;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

import io.petfeeder.backend.device.DeviceCommandException;
import io.petfeeder.backend.device.HardwareAdapter;
import io.petfeeder.backend.device.HardwareResponse;
import io.petfeeder.backend.exception.StoreException;
import io.petfeeder.backend.feed.WeightSafetyGate.WeightCheck;
import io.petfeeder.backend.schedule.ScheduleTimeCalculator;
import java.time.Clock;
import java.time.Instant;
import java.time.ZoneOffset;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.ArgumentCaptor;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

@ExtendWith(MockitoExtension.class)
class FeedServiceTest {

  private static final Instant NOW = Instant.parse("2025-12-13T14:00:30Z");

  @Mock private WeightSafetyGate weightSafetyGate;
  @Mock private HardwareAdapter hardwareAdapter;
  @Mock private FeedEventLog feedEventLog;

  private FeedService feedService;

  @BeforeEach
  void setUp() {
    feedService =
        new FeedService(
            weightSafetyGate,
            hardwareAdapter,
            feedEventLog,
            new ScheduleTimeCalculator(),
            Clock.fixed(NOW, ZoneOffset.UTC));
  }

  @Test
  void trigger_scheduledFeedSendsCommandAndLogsEvent() {
    when(weightSafetyGate.check()).thenReturn(new WeightCheck(true, 100.0, 450.0));
    when(hardwareAdapter.triggerFeed("owner@example.com", FeedMode.SCHEDULED, 3))
        .thenReturn(new HardwareResponse("sent", "Feed command sent to device"));

    var result = feedService.trigger(FeedRequest.scheduled("s-1", 3, "owner@example.com"));

    assertThat(result.status()).isEqualTo(FeedStatus.SENT);
    assertThat(result.isSuccessful()).isTrue();
    assertThat(result.eventType()).isEqualTo("scheduled_feed");
    assertThat(result.timestamp()).isEqualTo("2025-12-13T14:00:30Z");
    assertThat(result.scheduleId()).isEqualTo("s-1");
    verify(feedEventLog).append(result);
  }

  @Test
  void trigger_simulatedAndCompletedAreReportedAsSent() {
    when(weightSafetyGate.check()).thenReturn(new WeightCheck(true, null, null));
    when(hardwareAdapter.triggerFeed(anyString(), any(), anyInt()))
        .thenReturn(
            new HardwareResponse("simulated", null), new HardwareResponse("completed", null));

    var manual = feedService.trigger(new FeedRequest("me", FeedMode.MANUAL, 1, null));
    var api = feedService.trigger(new FeedRequest("me", FeedMode.API, 1, null));

    assertThat(manual.status()).isEqualTo(FeedStatus.SENT);
    assertThat(manual.eventType()).isEqualTo("manual_feed");
    assertThat(api.status()).isEqualTo(FeedStatus.SENT);
  }

  @Test
  void trigger_unrecognisedDeviceStatusIsFailure() {
    when(weightSafetyGate.check()).thenReturn(new WeightCheck(true, null, null));
    when(hardwareAdapter.triggerFeed(anyString(), any(), anyInt()))
        .thenReturn(new HardwareResponse("queued", null));

    var result = feedService.trigger(FeedRequest.scheduled("s-1", 1, "me"));

    assertThat(result.status()).isEqualTo(FeedStatus.FAILED);
  }

  @Test
  void trigger_deniedByWeightDoesNotReachDevice() {
    when(weightSafetyGate.check()).thenReturn(new WeightCheck(false, 500.0, 450.0));

    var result = feedService.trigger(FeedRequest.scheduled("s-1", 1, "me"));

    assertThat(result.status()).isEqualTo(FeedStatus.DENIED_WEIGHT_EXCEEDED);
    assertThat(result.isSuccessful()).isFalse();
    verify(hardwareAdapter, never()).triggerFeed(anyString(), any(), anyInt());
    var event = ArgumentCaptor.forClass(FeedResult.class);
    verify(feedEventLog).append(event.capture());
    assertThat(event.getValue().status()).isEqualTo(FeedStatus.DENIED_WEIGHT_EXCEEDED);
  }

  @Test
  void trigger_deviceExceptionBecomesFailedStatus() {
    when(weightSafetyGate.check()).thenReturn(new WeightCheck(true, null, null));
    when(hardwareAdapter.triggerFeed(anyString(), any(), anyInt()))
        .thenThrow(new DeviceCommandException("publish failed", new RuntimeException("timeout")));

    var result = feedService.trigger(FeedRequest.scheduled("s-1", 1, "me"));

    assertThat(result.status()).isEqualTo(FeedStatus.FAILED);
  }

  @Test
  void trigger_eventLogFailureDoesNotChangeResult() {
    when(weightSafetyGate.check()).thenReturn(new WeightCheck(true, null, null));
    when(hardwareAdapter.triggerFeed(anyString(), any(), anyInt()))
        .thenReturn(new HardwareResponse("sent", null));
    doThrow(new StoreException("write failed")).when(feedEventLog).append(any());

    var result = feedService.trigger(FeedRequest.scheduled("s-1", 1, "me"));

    assertThat(result.status()).isEqualTo(FeedStatus.SENT);
  }
}
