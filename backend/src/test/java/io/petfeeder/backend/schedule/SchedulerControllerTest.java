package io.petfeeder.backend.schedule;

import static org.assertj.core.api.Assertions.assertThat;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.get;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.post;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.jsonPath;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.status;

import io.petfeeder.backend.feed.WeightSafetyGate;
import io.petfeeder.backend.settings.FeederSettingsStore;
import io.petfeeder.backend.settings.InMemoryFeederSettingsStore;
import java.time.Clock;
import java.util.UUID;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.autoconfigure.web.servlet.AutoConfigureMockMvc;
import org.springframework.boot.test.context.SpringBootTest;
import org.springframework.test.context.ActiveProfiles;
import org.springframework.test.web.servlet.MockMvc;

@SpringBootTest
@AutoConfigureMockMvc
@ActiveProfiles("test")
class SchedulerControllerTest {

  @Autowired private MockMvc mockMvc;
  @Autowired private ScheduleStore scheduleStore;
  @Autowired private ScheduleTimeCalculator timeCalculator;
  @Autowired private InMemoryFeederSettingsStore settingsStore;
  @Autowired private WeightSafetyGate weightSafetyGate;
  @Autowired private Clock clock;

  @BeforeEach
  void setUp() {
    resetWeightThreshold();
  }

  @AfterEach
  void tearDown() {
    resetWeightThreshold();
  }

  @Test
  void shouldFireDueScheduleOnceAndRecordHistory() throws Exception {
    String id = dueSchedule("none");

    mockMvc
        .perform(post("/internal/scheduler/run"))
        .andExpect(status().isOk())
        .andExpect(jsonPath("$.statusCode").value(200))
        .andExpect(jsonPath("$.status_code").doesNotExist())
        .andExpect(jsonPath("$.body.total_schedules").isNumber())
        .andExpect(jsonPath("$.body.executed").isNumber())
        .andExpect(jsonPath("$.body.timestamp").isNotEmpty());

    var stored = scheduleStore.findById(id).orElseThrow();
    assertThat(stored.enabled()).isFalse();
    assertThat(stored.lastExecutedAt()).isEqualTo(stored.scheduledTime());

    mockMvc.perform(post("/internal/scheduler/run")).andExpect(status().isOk());

    mockMvc
        .perform(get("/api/schedules/" + id + "/executions"))
        .andExpect(status().isOk())
        .andExpect(jsonPath("$.length()").value(1))
        .andExpect(jsonPath("$[0].status").value("success"))
        .andExpect(jsonPath("$[0].environment").value("test"))
        .andExpect(jsonPath("$[0].scheduled_time").value(stored.scheduledTime()));
  }

  @Test
  void shouldLeaveScheduleDueWhenWeightGateDenies() throws Exception {
    settingsStore.put(FeederSettingsStore.WEIGHT_THRESHOLD_G, "100");
    String id = dueSchedule("daily");
    var before = scheduleStore.findById(id).orElseThrow();

    mockMvc.perform(post("/internal/scheduler/run")).andExpect(status().isOk());

    assertThat(scheduleStore.findById(id)).contains(before);
    mockMvc
        .perform(get("/api/schedules/" + id + "/executions"))
        .andExpect(jsonPath("$[0].status").value("failed"))
        .andExpect(
            jsonPath("$[0].error_message").value("Failed to trigger feed: denied_weight_exceeded"));
  }

  private void resetWeightThreshold() {
    settingsStore.clear();
    weightSafetyGate.evictThreshold();
  }

  private String dueSchedule(String recurrence) {
    String id = UUID.randomUUID().toString();
    String scheduledTime = timeCalculator.format(clock.instant().minusSeconds(30));
    scheduleStore.put(
        new FeedSchedule(
            id,
            "runner@example.com",
            scheduledTime,
            1,
            recurrence,
            true,
            "UTC",
            null,
            scheduledTime,
            scheduledTime));
    return id;
  }
}
