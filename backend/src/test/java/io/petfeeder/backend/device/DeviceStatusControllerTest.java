package io.petfeeder.backend.device;

import static org.mockito.Mockito.when;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.get;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.jsonPath;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.status;

import java.util.Optional;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.autoconfigure.web.servlet.AutoConfigureMockMvc;
import org.springframework.boot.test.context.SpringBootTest;
import org.springframework.test.context.ActiveProfiles;
import org.springframework.test.context.bean.override.mockito.MockitoBean;
import org.springframework.test.web.servlet.MockMvc;

@SpringBootTest
@AutoConfigureMockMvc
@ActiveProfiles("test")
class DeviceStatusControllerTest {

  @Autowired private MockMvc mockMvc;
  @MockitoBean private HardwareAdapter hardwareAdapter;

  @Test
  void shouldReturnLatestDeviceStatus() throws Exception {
    when(hardwareAdapter.getDeviceStatus())
        .thenReturn(
            Optional.of(
                new DeviceStatus("feeder-1", "ready", "online", 80.5, "2025-12-13T13:59:00Z")));

    mockMvc
        .perform(get("/api/status"))
        .andExpect(status().isOk())
        .andExpect(jsonPath("$.thing_id").value("feeder-1"))
        .andExpect(jsonPath("$.status").value("ready"))
        .andExpect(jsonPath("$.network_status").value("online"))
        .andExpect(jsonPath("$.current_weight_g").value(80.5))
        .andExpect(jsonPath("$.last_updated").value("2025-12-13T13:59:00Z"));
  }

  @Test
  void shouldReturn404WhenDeviceHasNeverReported() throws Exception {
    when(hardwareAdapter.getDeviceStatus()).thenReturn(Optional.empty());

    mockMvc
        .perform(get("/api/status"))
        .andExpect(status().isNotFound())
        .andExpect(jsonPath("$.title").value("Device status not found"));
  }
}
