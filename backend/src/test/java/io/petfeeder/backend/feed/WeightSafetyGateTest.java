package io.petfeeder.backend.feed;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.Mockito.times;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

import io.petfeeder.backend.device.DeviceStatus;
import io.petfeeder.backend.device.HardwareAdapter;
import io.petfeeder.backend.exception.StoreException;
import io.petfeeder.backend.settings.FeederSettingsStore;
import java.time.Duration;
import java.util.Optional;
import java.util.concurrent.atomic.AtomicLong;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

@ExtendWith(MockitoExtension.class)
class WeightSafetyGateTest {

  private static final String KEY = FeederSettingsStore.WEIGHT_THRESHOLD_G;

  @Mock private HardwareAdapter hardwareAdapter;
  @Mock private FeederSettingsStore settingsStore;

  private final AtomicLong nanos = new AtomicLong();
  private WeightSafetyGate gate;

  @BeforeEach
  void setUp() {
    var properties = new FeedProperties(450.0, Duration.ofSeconds(60), 0);
    gate = new WeightSafetyGate(hardwareAdapter, settingsStore, properties, nanos::get);
  }

  @Test
  void check_deniesAtOrAboveConfiguredThreshold() {
    when(hardwareAdapter.getDeviceStatus()).thenReturn(weighing(300.0));
    when(settingsStore.findValue(KEY)).thenReturn(Optional.of("300"));

    var check = gate.check();

    assertThat(check.allowed()).isFalse();
    assertThat(check.currentWeightG()).isEqualTo(300.0);
    assertThat(check.thresholdG()).isEqualTo(300.0);
  }

  @Test
  void check_allowsBelowDefaultThresholdWhenNoneConfigured() {
    when(hardwareAdapter.getDeviceStatus()).thenReturn(weighing(449.9));
    when(settingsStore.findValue(KEY)).thenReturn(Optional.empty());

    var check = gate.check();

    assertThat(check.allowed()).isTrue();
    assertThat(check.thresholdG()).isEqualTo(450.0);
  }

  @Test
  void check_missingWeightCountsAsEmptyBowl() {
    when(hardwareAdapter.getDeviceStatus()).thenReturn(weighing(null));
    when(settingsStore.findValue(KEY)).thenReturn(Optional.of("10"));

    assertThat(gate.check().allowed()).isTrue();
  }

  @Test
  void check_allowsWhenDeviceNeverReported() {
    when(hardwareAdapter.getDeviceStatus()).thenReturn(Optional.empty());

    var check = gate.check();

    assertThat(check.allowed()).isTrue();
    assertThat(check.thresholdG()).isNull();
  }

  @Test
  void check_failsOpenWhenSettingsUnreadable() {
    when(hardwareAdapter.getDeviceStatus()).thenReturn(weighing(900.0));
    when(settingsStore.findValue(KEY)).thenThrow(new StoreException("table missing"));

    assertThat(gate.check().allowed()).isTrue();
  }

  @Test
  void check_ignoresNonNumericThreshold() {
    when(hardwareAdapter.getDeviceStatus()).thenReturn(weighing(460.0));
    when(settingsStore.findValue(KEY)).thenReturn(Optional.of("lots"));

    var check = gate.check();

    assertThat(check.allowed()).isFalse();
    assertThat(check.thresholdG()).isEqualTo(450.0);
  }

  @Test
  void thresholdG_isCachedUntilTtlExpires() {
    when(settingsStore.findValue(KEY)).thenReturn(Optional.of("200"), Optional.of("250"));

    assertThat(gate.thresholdG()).isEqualTo(200.0);
    nanos.addAndGet(Duration.ofSeconds(59).toNanos());
    assertThat(gate.thresholdG()).isEqualTo(200.0);
    nanos.addAndGet(Duration.ofSeconds(2).toNanos());
    assertThat(gate.thresholdG()).isEqualTo(250.0);

    verify(settingsStore, times(2)).findValue(KEY);
  }

  @Test
  void evictThreshold_forcesReload() {
    when(settingsStore.findValue(KEY)).thenReturn(Optional.of("200"), Optional.of("150"));

    gate.thresholdG();
    gate.evictThreshold();

    assertThat(gate.thresholdG()).isEqualTo(150.0);
  }

  private static Optional<DeviceStatus> weighing(Double grams) {
    return Optional.of(
        new DeviceStatus("feeder-1", "ready", "online", grams, "2025-12-13T14:00:00Z"));
  }
}
