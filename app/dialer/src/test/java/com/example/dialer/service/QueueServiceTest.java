/*
 * どこで: Dialer キュー操作のユニットテスト
 * 何を: 番号検証、優先度の既定値、発信中エントリの削除拒否、クールダウン計算を検証する
 * なぜ: API から渡された不正入力でキューが部分的に汚れないことを担保するため
 */
package com.example.dialer.service;

import static com.example.dialer.service.CallAttemptFixtures.FIXED_NOW;
import static com.example.dialer.service.CallAttemptFixtures.ORG;
import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyInt;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

import com.example.dialer.api.InvalidDialerRequestException;
import com.example.dialer.api.QueueEntryBusyException;
import com.example.dialer.api.request.EnqueueLeadsRequest;
import com.example.dialer.api.request.LeadRequest;
import com.example.dialer.api.response.EnqueueLeadsResponse;
import com.example.dialer.api.response.QueueStatusResponse;
import com.example.dialer.config.DialerQueueProperties;
import com.example.dialer.model.Disposition;
import com.example.dialer.model.QueueEntryRecord;
import com.example.dialer.model.QueueEntryStatus;
import com.example.dialer.repository.QueueEntryRepository;
import com.example.dialer.repository.RepSessionRepository;
import java.time.Clock;
import java.time.Duration;
import java.time.ZoneOffset;
import java.util.EnumMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.UUID;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

@ExtendWith(MockitoExtension.class)
class QueueServiceTest {

  @Mock private QueueEntryRepository queueEntryRepository;
  @Mock private RepSessionRepository repSessionRepository;

  private QueueService service;

  @BeforeEach
  void setUp() {
    service =
        new QueueService(
            queueEntryRepository,
            repSessionRepository,
            new DialerQueueProperties(3, Duration.ofMinutes(10), 20),
            Clock.fixed(FIXED_NOW, ZoneOffset.UTC));
  }

  @Test
  void enqueueNormalizesPhonesAndDefaultsPriority() {
    when(queueEntryRepository.upsert(
            ORG, "lead-1", "+14155550100", "Ada", 0, "rep-1", FIXED_NOW))
        .thenReturn(queued("lead-1", "+14155550100", 0));

    final EnqueueLeadsResponse response =
        service.enqueue(
            ORG,
            new EnqueueLeadsRequest(
                List.of(new LeadRequest("lead-1", "(415) 555-0100", "Ada")), null, "rep-1"));

    assertThat(response.accepted()).isEqualTo(1);
    assertThat(response.entries().get(0).leadPhone()).isEqualTo("+14155550100");
    assertThat(response.entries().get(0).status()).isEqualTo("QUEUED");
  }

  @Test
  void oneInvalidPhoneRejectsWholeBatch() {
    final EnqueueLeadsRequest request =
        new EnqueueLeadsRequest(
            List.of(
                new LeadRequest("lead-1", "+14155550100", null),
                new LeadRequest("lead-2", "12345", null)),
            5,
            null);

    assertThatThrownBy(() -> service.enqueue(ORG, request))
        .isInstanceOf(InvalidDialerRequestException.class)
        .hasMessageContaining("lead-2");
    verify(queueEntryRepository, never())
        .upsert(anyString(), anyString(), anyString(), any(), anyInt(), any(), any());
  }

  @Test
  void removeRejectsLeadBeingDialed() {
    when(queueEntryRepository.deleteIdle(ORG, "lead-1")).thenReturn(0);
    when(queueEntryRepository.findByOrgAndLead(ORG, "lead-1"))
        .thenReturn(Optional.of(queued("lead-1", "+14155550100", 0)));

    assertThatThrownBy(() -> service.remove(ORG, "lead-1"))
        .isInstanceOf(QueueEntryBusyException.class);
  }

  @Test
  void removeOfUnknownLeadReportsZero() {
    when(queueEntryRepository.deleteIdle(ORG, "lead-x")).thenReturn(0);
    when(queueEntryRepository.findByOrgAndLead(ORG, "lead-x")).thenReturn(Optional.empty());

    assertThat(service.remove(ORG, "lead-x").removed()).isZero();
  }

  @Test
  void markOutcomeAppliesRetryLimitAndCooldown() {
    final UUID entryId = UUID.randomUUID();
    when(queueEntryRepository.markOutcome(
            entryId, Disposition.NO_ANSWER, 3, FIXED_NOW.plus(Duration.ofMinutes(10))))
        .thenReturn(Optional.of(QueueEntryStatus.QUEUED));

    assertThat(service.markOutcome(entryId, Disposition.NO_ANSWER))
        .contains(QueueEntryStatus.QUEUED);
  }

  @Test
  void statusReportsEveryStatusAndAvailableReps() {
    final Map<QueueEntryStatus, Integer> counts = new EnumMap<>(QueueEntryStatus.class);
    for (QueueEntryStatus status : QueueEntryStatus.values()) {
      counts.put(status, 0);
    }
    counts.put(QueueEntryStatus.QUEUED, 2);
    when(queueEntryRepository.countByStatus(ORG)).thenReturn(counts);
    when(queueEntryRepository.findByOrgOrdered(ORG, 20))
        .thenReturn(List.of(queued("lead-1", "+14155550100", 9)));
    when(repSessionRepository.countAvailable(ORG)).thenReturn(4);

    final QueueStatusResponse response = service.status(ORG);

    assertThat(response.counts()).containsEntry("QUEUED", 2).containsEntry("FAILED", 0);
    assertThat(response.availableReps()).isEqualTo(4);
    assertThat(response.entries()).singleElement().extracting("priority").isEqualTo(9);
  }

  @Test
  void blankOrgIsRejected() {
    assertThatThrownBy(() -> service.clear(" "))
        .isInstanceOf(InvalidDialerRequestException.class)
        .hasMessage("org_id is required");
  }

  private static QueueEntryRecord queued(String leadId, String phone, int priority) {
    return new QueueEntryRecord(
        UUID.randomUUID(),
        ORG,
        leadId,
        phone,
        "Ada",
        priority,
        QueueEntryStatus.QUEUED,
        FIXED_NOW,
        "rep-1",
        null,
        null,
        0,
        null);
  }
}
