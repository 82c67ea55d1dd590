package com.example.dialer.api;

import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.verifyNoInteractions;
import static org.mockito.Mockito.when;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.delete;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.get;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.post;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.jsonPath;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.status;

import com.example.dialer.api.request.EnqueueLeadsRequest;
import com.example.dialer.api.response.EnqueueLeadsResponse;
import com.example.dialer.api.response.QueueEntrySummary;
import com.example.dialer.api.response.QueueRemovalResponse;
import com.example.dialer.api.response.QueueStatusResponse;
import com.example.dialer.service.QueueService;
import java.util.List;
import java.util.Map;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.autoconfigure.web.servlet.AutoConfigureMockMvc;
import org.springframework.boot.test.autoconfigure.web.servlet.WebMvcTest;
import org.springframework.context.annotation.Import;
import org.springframework.http.MediaType;
import org.springframework.test.context.bean.override.mockito.MockitoBean;
import org.springframework.test.web.servlet.MockMvc;

@WebMvcTest(QueueController.class)
@AutoConfigureMockMvc(addFilters = false)
@Import(ApiExceptionHandler.class)
class QueueControllerTest {

  @Autowired private MockMvc mockMvc;

  @MockitoBean private QueueService queueService;

  @Test
  void enqueueReturns202() throws Exception {
    when(queueService.enqueue(eq("org-1"), any(EnqueueLeadsRequest.class)))
        .thenReturn(new EnqueueLeadsResponse(1, List.of(summary("lead-1", "QUEUED"))));

    mockMvc
        .perform(
            post("/v1/orgs/org-1/queue/entries")
                .contentType(MediaType.APPLICATION_JSON)
                .content(
                    """
                    {"leads":[{"lead_id":"lead-1","phone":"4155550100","name":"Ada"}],"priority":5}
                    """))
        .andExpect(status().isAccepted())
        .andExpect(jsonPath("$.accepted").value(1))
        .andExpect(jsonPath("$.entries[0].lead_phone").value("+14155550100"));
  }

  @Test
  void enqueueReturns400WhenLeadsMissing() throws Exception {
    mockMvc
        .perform(
            post("/v1/orgs/org-1/queue/entries")
                .contentType(MediaType.APPLICATION_JSON)
                .content("{\"leads\":[]}"))
        .andExpect(status().isBadRequest())
        .andExpect(jsonPath("$.code").value("BAD_REQUEST"))
        .andExpect(jsonPath("$.message").value("leads is required"));
    verifyNoInteractions(queueService);
  }

  @Test
  void enqueueReturns400WhenPhoneInvalid() throws Exception {
    when(queueService.enqueue(eq("org-1"), any(EnqueueLeadsRequest.class)))
        .thenThrow(new InvalidDialerRequestException("phone is invalid: lead_id=lead-1"));

    mockMvc
        .perform(
            post("/v1/orgs/org-1/queue/entries")
                .contentType(MediaType.APPLICATION_JSON)
                .content("{\"leads\":[{\"lead_id\":\"lead-1\",\"phone\":\"123\"}]}"))
        .andExpect(status().isBadRequest())
        .andExpect(jsonPath("$.message").value("phone is invalid: lead_id=lead-1"));
  }

  @Test
  void statusReturnsCountsAndEntries() throws Exception {
    when(queueService.status("org-1"))
        .thenReturn(
            new QueueStatusResponse(
                "org-1", Map.of("QUEUED", 1), 2, List.of(summary("lead-1", "QUEUED"))));

    mockMvc
        .perform(get("/v1/orgs/org-1/queue"))
        .andExpect(status().isOk())
        .andExpect(jsonPath("$.counts.QUEUED").value(1))
        .andExpect(jsonPath("$.available_reps").value(2))
        .andExpect(jsonPath("$.entries[0].lead_id").value("lead-1"));
  }

  @Test
  void removeReturns409WhenLeadIsBeingDialed() throws Exception {
    when(queueService.remove("org-1", "lead-1")).thenThrow(new QueueEntryBusyException("lead-1"));

    mockMvc
        .perform(delete("/v1/orgs/org-1/queue/entries/lead-1"))
        .andExpect(status().isConflict())
        .andExpect(jsonPath("$.code").value("QUEUE_ENTRY_BUSY"));
  }

  @Test
  void clearReturnsRemovedCount() throws Exception {
    when(queueService.clear("org-1")).thenReturn(new QueueRemovalResponse(3));

    mockMvc
        .perform(delete("/v1/orgs/org-1/queue/entries"))
        .andExpect(status().isOk())
        .andExpect(jsonPath("$.removed").value(3));
  }

  private static QueueEntrySummary summary(String leadId, String status) {
    return new QueueEntrySummary(
        "00000000-0000-0000-0000-000000000001",
        leadId,
        "Ada",
        "+14155550100",
        5,
        status,
        0,
        null,
        "2026-01-17T00:00:00Z",
        null);
  }
}
