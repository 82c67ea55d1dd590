package com.example.dialer.service;

import static com.example.dialer.service.CallAttemptFixtures.FIXED_NOW;
import static com.example.dialer.service.CallAttemptFixtures.attempt;
import static com.example.dialer.service.CallAttemptFixtures.connected;
import static com.example.dialer.service.CallAttemptFixtures.withStatus;
import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;

import com.example.common.event.CallLifecycleEventPayload;
import com.example.dialer.model.CallAttemptRecord;
import com.example.dialer.model.CallAttemptStatus;
import com.example.dialer.model.Disposition;
import com.example.dialer.repository.OutboxEventRepository;
import com.fasterxml.jackson.databind.ObjectMapper;
import java.time.Clock;
import java.time.ZoneOffset;
import java.util.UUID;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.ArgumentCaptor;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

@ExtendWith(MockitoExtension.class)
class CallCompletionRecorderTest {

  @Mock private QueueService queueService;
  @Mock private RepPoolService repPoolService;
  @Mock private OutboxEventRepository outboxEventRepository;

  private final ObjectMapper objectMapper = new ObjectMapper();
  private CallCompletionRecorder recorder;

  @BeforeEach
  void setUp() {
    recorder =
        new CallCompletionRecorder(
            queueService,
            repPoolService,
            outboxEventRepository,
            objectMapper,
            Clock.fixed(FIXED_NOW, ZoneOffset.UTC));
  }

  @Test
  void conversationCountsTowardRepAndEmitsEvent() throws Exception {
    final UUID sessionId = UUID.randomUUID();
    final CallAttemptRecord completed =
        withStatus(connected("CA-1", sessionId, "turbo-conf", 95), CallAttemptStatus.COMPLETED);

    recorder.recordTerminal(completed, Disposition.COMPLETED, "req-9");

    verify(queueService).markOutcome(completed.queueEntryId(), Disposition.COMPLETED);
    verify(repPoolService).incrementConnected(sessionId);
    final ArgumentCaptor<String> json = ArgumentCaptor.forClass(String.class);
    final ArgumentCaptor<UUID> eventId = ArgumentCaptor.forClass(UUID.class);
    verify(outboxEventRepository)
        .insertCallEvent(
            eventId.capture(),
            eq("CallCompleted"),
            eq("org-1"),
            eq("CA-1"),
            json.capture(),
            eq(FIXED_NOW));

    final CallLifecycleEventPayload payload =
        objectMapper.readValue(json.getValue(), CallLifecycleEventPayload.class);
    assertThat(payload.eventId()).isEqualTo(eventId.getValue().toString());
    assertThat(payload.finalStatus()).isEqualTo("COMPLETED");
    assertThat(payload.assignedRepId()).isEqualTo("rep-1");
    assertThat(payload.durationSeconds()).isEqualTo(95L);
    assertThat(payload.batchId()).isEqualTo(CallAttemptFixtures.BATCH_ID.toString());
    assertThat(payload.traceId()).isEqualTo("req-9");
    assertThat(json.getValue()).contains("\"call_handle\":\"CA-1\"");
  }

  @Test
  void unansweredCallDoesNotCountTowardRep() {
    final CallAttemptRecord noAnswer =
        withStatus(attempt("CA-2", CallAttemptStatus.RINGING), CallAttemptStatus.NO_ANSWER);

    recorder.recordTerminal(noAnswer, Disposition.NO_ANSWER, null);

    verify(queueService).markOutcome(noAnswer.queueEntryId(), Disposition.NO_ANSWER);
    verify(repPoolService, never()).incrementConnected(any());
    verify(outboxEventRepository)
        .insertCallEvent(
            any(UUID.class),
            eq("CallCompleted"),
            eq("org-1"),
            eq("CA-2"),
            any(String.class),
            eq(FIXED_NOW));
  }
}
