package com.example.scheduler.config;

import static org.mockito.Mockito.when;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.get;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.status;

import com.example.scheduler.api.HealthController;
import com.example.scheduler.api.ScheduledMessageController;
import com.example.scheduler.service.ScheduledMessageService;
import java.util.List;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.autoconfigure.web.servlet.AutoConfigureMockMvc;
import org.springframework.boot.test.autoconfigure.web.servlet.WebMvcTest;
import org.springframework.context.annotation.Import;
import org.springframework.test.context.TestPropertySource;
import org.springframework.test.context.bean.override.mockito.MockitoBean;
import org.springframework.test.web.servlet.MockMvc;

@WebMvcTest({ScheduledMessageController.class, HealthController.class})
@AutoConfigureMockMvc
@Import(SchedulerSecurityConfig.class)
@TestPropertySource(properties = "scheduler.api.token=test-token")
class SchedulerSecurityConfigTest {

  @Autowired private MockMvc mockMvc;

  @MockitoBean private ScheduledMessageService scheduledMessageService;

  @Test
  void messagesRejectWithoutToken() throws Exception {
    mockMvc.perform(get("/messages")).andExpect(status().isUnauthorized());
  }

  @Test
  void messagesRejectWrongToken() throws Exception {
    mockMvc
        .perform(get("/messages").header("Authorization", "Bearer wrong-token"))
        .andExpect(status().isUnauthorized());
  }

  @Test
  void messagesRejectNonBearerScheme() throws Exception {
    mockMvc
        .perform(get("/messages").header("Authorization", "Basic test-token"))
        .andExpect(status().isUnauthorized());
  }

  @Test
  void messagesAllowValidBearerToken() throws Exception {
    when(scheduledMessageService.listInMemory()).thenReturn(List.of());

    mockMvc
        .perform(get("/messages").header("Authorization", "Bearer test-token"))
        .andExpect(status().isOk());
  }

  @Test
  void healthIsPublic() throws Exception {
    when(scheduledMessageService.healthCheck())
        .thenReturn(new ScheduledMessageService.HealthStatus(true, null, List.of()));

    mockMvc.perform(get("/health")).andExpect(status().isOk());
  }
}
