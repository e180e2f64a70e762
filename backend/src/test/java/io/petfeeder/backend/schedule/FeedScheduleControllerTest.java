package io.petfeeder.backend.schedule;

import static org.hamcrest.Matchers.nullValue;
import static org.hamcrest.Matchers.startsWith;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.delete;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.get;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.patch;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.post;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.put;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.header;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.jsonPath;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.status;

import com.jayway.jsonpath.JsonPath;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.autoconfigure.web.servlet.AutoConfigureMockMvc;
import org.springframework.boot.test.context.SpringBootTest;
import org.springframework.http.MediaType;
import org.springframework.test.context.ActiveProfiles;
import org.springframework.test.web.servlet.MockMvc;

@SpringBootTest
@AutoConfigureMockMvc
@ActiveProfiles("test")
class FeedScheduleControllerTest {

  @Autowired private MockMvc mockMvc;
  @Autowired private ScheduleStore scheduleStore;

  @Test
  void shouldCreateScheduleInUtc() throws Exception {
    mockMvc
        .perform(
            post("/api/schedules")
                .contentType(MediaType.APPLICATION_JSON)
                .content(
                    """
                    {
                      "requested_by": "create@example.com",
                      "scheduled_time": "2030-01-15T08:00:00",
                      "feed_cycles": 3,
                      "recurrence": "daily",
                      "timezone": "America/New_York"
                    }
                    """))
        .andExpect(status().isCreated())
        .andExpect(header().string("Location", startsWith("/api/schedules/")))
        .andExpect(jsonPath("$.schedule_id").isNotEmpty())
        .andExpect(jsonPath("$.scheduled_time").value("2030-01-15T13:00:00Z"))
        .andExpect(jsonPath("$.feed_cycles").value(3))
        .andExpect(jsonPath("$.recurrence").value("daily"))
        .andExpect(jsonPath("$.enabled").value(true))
        .andExpect(jsonPath("$.next_execution").value("2030-01-15T13:00:00Z"))
        .andExpect(jsonPath("$.last_executed_at").value(nullValue()));
  }

  @Test
  void shouldRejectOutOfRangeFeedCycles() throws Exception {
    mockMvc
        .perform(
            post("/api/schedules")
                .contentType(MediaType.APPLICATION_JSON)
                .content(
                    """
                    {"requested_by": "a@example.com", "scheduled_time": "2030-01-15T08:00:00Z",
                     "feed_cycles": 11}
                    """))
        .andExpect(status().isBadRequest());
  }

  @Test
  void shouldRejectUnknownRecurrence() throws Exception {
    mockMvc
        .perform(
            post("/api/schedules")
                .contentType(MediaType.APPLICATION_JSON)
                .content(
                    """
                    {"requested_by": "a@example.com", "scheduled_time": "2030-01-15T08:00:00Z",
                     "recurrence": "hourly"}
                    """))
        .andExpect(status().isBadRequest());
  }

  @Test
  void shouldRejectUnparseableTimeWithProblemDetail() throws Exception {
    mockMvc
        .perform(
            post("/api/schedules")
                .contentType(MediaType.APPLICATION_JSON)
                .content(
                    """
                    {"requested_by": "a@example.com", "scheduled_time": "next tuesday"}
                    """))
        .andExpect(status().isBadRequest())
        .andExpect(jsonPath("$.title").value("Invalid schedule time"));
  }

  @Test
  void shouldReturn404ForMissingSchedule() throws Exception {
    mockMvc
        .perform(get("/api/schedules/does-not-exist"))
        .andExpect(status().isNotFound())
        .andExpect(jsonPath("$.title").value("Schedule not found"));
  }

  @Test
  void shouldClearLastExecutedAtWhenTimeChanges() throws Exception {
    String id = createSchedule("edit@example.com", "2030-02-01T08:00:00Z");
    scheduleStore.update(
        id, ScheduleUpdate.builder().lastExecutedAt("2030-02-01T08:00:00Z").build());

    mockMvc
        .perform(
            put("/api/schedules/" + id)
                .contentType(MediaType.APPLICATION_JSON)
                .content(
                    """
                    {"scheduled_time": "2030-02-02T09:30:00"}
                    """))
        .andExpect(status().isOk())
        .andExpect(jsonPath("$.scheduled_time").value("2030-02-02T09:30:00Z"))
        .andExpect(jsonPath("$.last_executed_at").value(nullValue()));
  }

  @Test
  void shouldToggleEnabled() throws Exception {
    String id = createSchedule("toggle@example.com", "2030-03-01T08:00:00Z");

    mockMvc
        .perform(patch("/api/schedules/" + id + "/enabled").param("enabled", "false"))
        .andExpect(status().isOk())
        .andExpect(jsonPath("$.enabled").value(false))
        .andExpect(jsonPath("$.next_execution").value(nullValue()));
  }

  @Test
  void shouldDeleteSchedule() throws Exception {
    String id = createSchedule("delete@example.com", "2030-04-01T08:00:00Z");

    mockMvc.perform(delete("/api/schedules/" + id)).andExpect(status().isNoContent());
    mockMvc.perform(get("/api/schedules/" + id)).andExpect(status().isNotFound());
  }

  @Test
  void shouldListSchedulesForOwner() throws Exception {
    createSchedule("lister@example.com", "2030-05-01T08:00:00Z");
    createSchedule("lister@example.com", "2030-05-02T08:00:00Z");
    createSchedule("someone-else@example.com", "2030-05-03T08:00:00Z");

    mockMvc
        .perform(
            get("/api/schedules")
                .param("requested_by", "lister@example.com")
                .param("page_size", "1"))
        .andExpect(status().isOk())
        .andExpect(jsonPath("$.total").value(2))
        .andExpect(jsonPath("$.page_size").value(1))
        .andExpect(jsonPath("$.has_next").value(true))
        .andExpect(jsonPath("$.schedules.length()").value(1))
        .andExpect(jsonPath("$.schedules[0].requested_by").value("lister@example.com"));
  }

  private String createSchedule(String requestedBy, String scheduledTime) throws Exception {
    var result =
        mockMvc
            .perform(
                post("/api/schedules")
                    .contentType(MediaType.APPLICATION_JSON)
                    .content(
                        """
                        {"requested_by": "%s", "scheduled_time": "%s"}
                        """
                            .formatted(requestedBy, scheduledTime)))
            .andExpect(status().isCreated())
            .andReturn();
    return JsonPath.read(result.getResponse().getContentAsString(), "$.schedule_id");
  }
}
