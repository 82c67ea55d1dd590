/*
 * どこで: Dialer テスト
 * 何を: 発信キューの取り出し順/リトライ上限/再投入を Postgres で検証する
 * なぜ: 状態判定を 1 文の UPDATE に寄せているため、SQL の CASE 分岐を実 DB で確かめるため
 */
package com.example.dialer.repository;

import static org.assertj.core.api.Assertions.assertThat;

import com.example.dialer.AbstractPostgresContainerTest;
import com.example.dialer.model.Disposition;
import com.example.dialer.model.QueueEntryRecord;
import com.example.dialer.model.QueueEntryStatus;
import java.time.Duration;
import java.time.Instant;
import java.time.temporal.ChronoUnit;
import java.util.List;
import java.util.Map;
import java.util.UUID;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.context.SpringBootTest;
import org.springframework.jdbc.core.namedparam.MapSqlParameterSource;
import org.springframework.jdbc.core.namedparam.NamedParameterJdbcTemplate;
import org.springframework.test.context.ActiveProfiles;

@SpringBootTest
@ActiveProfiles("test")
class QueueEntryRepositoryTest extends AbstractPostgresContainerTest {

  private static final String ORG = "org-queue";
  private static final int RETRY_LIMIT = 3;

  @Autowired private QueueEntryRepository queueEntryRepository;

  @Autowired private CallAttemptRepository callAttemptRepository;

  @Autowired private NamedParameterJdbcTemplate jdbcTemplate;

  @BeforeEach
  void cleanup() {
    jdbcTemplate.update("DELETE FROM call_attempts", new MapSqlParameterSource());
    jdbcTemplate.update("DELETE FROM queue_entries", new MapSqlParameterSource());
  }

  @Test
  void claimNextBatchOrdersByPriorityThenAge() {
    final Instant base = Instant.now().truncatedTo(ChronoUnit.MILLIS);
    queueEntryRepository.upsert(ORG, "lead-old-low", "+15551230001", null, 0, null, base);
    queueEntryRepository.upsert(
        ORG, "lead-new-high", "+15551230002", null, 5, null, base.plusSeconds(2));
    queueEntryRepository.upsert(
        ORG, "lead-old-high", "+15551230003", null, 5, null, base.plusSeconds(1));
    queueEntryRepository.upsert(
        ORG, "lead-new-low", "+15551230004", null, 0, null, base.plusSeconds(3));

    final List<QueueEntryRecord> claimed =
        queueEntryRepository.claimNextBatch(ORG, 3, base.plusSeconds(10));

    assertThat(claimed)
        .extracting(QueueEntryRecord::leadId)
        .containsExactly("lead-old-high", "lead-new-high", "lead-old-low");
    assertThat(claimed).allMatch(entry -> entry.status() == QueueEntryStatus.DIALING);
    // 取り出し済みのエントリは次のサイクルで再度取り出されない
    assertThat(queueEntryRepository.claimNextBatch(ORG, 10, base.plusSeconds(10)))
        .extracting(QueueEntryRecord::leadId)
        .containsExactly("lead-new-low");
  }

  @Test
  void claimNextBatchHonorsRetryCooldown() {
    final Instant now = Instant.now().truncatedTo(ChronoUnit.MILLIS);
    final QueueEntryRecord entry =
        queueEntryRepository.upsert(ORG, "lead-1", "+15551230001", null, 0, null, now);
    queueEntryRepository.claimNextBatch(ORG, 1, now);
    queueEntryRepository.markOutcome(
        entry.entryId(), Disposition.NO_ANSWER, RETRY_LIMIT, now.plus(Duration.ofMinutes(5)));

    assertThat(queueEntryRepository.claimNextBatch(ORG, 1, now.plusSeconds(1))).isEmpty();
    assertThat(queueEntryRepository.claimNextBatch(ORG, 1, now.plus(Duration.ofMinutes(6))))
        .hasSize(1);
  }

  @Test
  void retryableOutcomesFailEntryAtRetryLimit() {
    final Instant now = Instant.now();
    final QueueEntryRecord entry =
        queueEntryRepository.upsert(ORG, "lead-1", "+15551230001", null, 0, null, now);

    assertThat(
            queueEntryRepository.markOutcome(entry.entryId(), Disposition.BUSY, RETRY_LIMIT, now))
        .contains(QueueEntryStatus.QUEUED);
    assertThat(
            queueEntryRepository.markOutcome(
                entry.entryId(), Disposition.NO_ANSWER, RETRY_LIMIT, now))
        .contains(QueueEntryStatus.QUEUED);
    assertThat(
            queueEntryRepository.markOutcome(entry.entryId(), Disposition.FAILED, RETRY_LIMIT, now))
        .contains(QueueEntryStatus.FAILED);
    // 終端後の結果反映は何もしない
    assertThat(queueEntryRepository.markOutcome(entry.entryId(), Disposition.BUSY, RETRY_LIMIT, now))
        .isEmpty();

    final QueueEntryRecord failed = queueEntryRepository.findById(entry.entryId()).orElseThrow();
    assertThat(failed.attemptCount()).isEqualTo(RETRY_LIMIT);
    assertThat(failed.lastDisposition()).isEqualTo(Disposition.FAILED);
    assertThat(failed.nextAttemptAfter()).isNull();
  }

  @Test
  void nonRetryableOutcomeCompletesWithoutCountingAttempt() {
    final Instant now = Instant.now();
    final QueueEntryRecord entry =
        queueEntryRepository.upsert(ORG, "lead-1", "+15551230001", null, 0, null, now);

    assertThat(
            queueEntryRepository.markOutcome(
                entry.entryId(), Disposition.VOICEMAIL, RETRY_LIMIT, now))
        .contains(QueueEntryStatus.COMPLETED);
    assertThat(queueEntryRepository.findById(entry.entryId()).orElseThrow().attemptCount())
        .isZero();
  }

  @Test
  void upsertRequeuesFinishedEntryButKeepsActiveOne() {
    final Instant now = Instant.now().truncatedTo(ChronoUnit.MILLIS);
    final QueueEntryRecord finished =
        queueEntryRepository.upsert(ORG, "lead-done", "+15551230001", "Done", 0, null, now);
    queueEntryRepository.markOutcome(finished.entryId(), Disposition.COMPLETED, RETRY_LIMIT, now);
    queueEntryRepository.upsert(ORG, "lead-live", "+15551230002", null, 0, null, now);
    queueEntryRepository.claimNextBatch(ORG, 10, now);

    final QueueEntryRecord requeued =
        queueEntryRepository.upsert(ORG, "lead-done", "+15551230001", null, 7, "crm", now);
    final QueueEntryRecord stillDialing =
        queueEntryRepository.upsert(ORG, "lead-live", "+15551230002", null, 9, "crm", now);

    assertThat(requeued.entryId()).isEqualTo(finished.entryId());
    assertThat(requeued.status()).isEqualTo(QueueEntryStatus.QUEUED);
    assertThat(requeued.priority()).isEqualTo(7);
    assertThat(requeued.leadName()).isEqualTo("Done");
    assertThat(stillDialing.status()).isEqualTo(QueueEntryStatus.DIALING);
    assertThat(stillDialing.priority()).isEqualTo(9);
  }

  @Test
  void deleteIdleSkipsEntryBeingDialed() {
    final Instant now = Instant.now();
    final QueueEntryRecord entry =
        queueEntryRepository.upsert(ORG, "lead-1", "+15551230001", null, 0, null, now);
    queueEntryRepository.upsert(ORG, "lead-2", "+15551230002", null, -1, null, now);
    queueEntryRepository.claimNextBatch(ORG, 1, now);
    callAttemptRepository.insertDialing(
        "CA-1", entry.entryId(), ORG, "lead-1", "+15551230001", UUID.randomUUID(), null, now);

    assertThat(queueEntryRepository.deleteIdle(ORG, "lead-1")).isZero();
    assertThat(queueEntryRepository.deleteAllIdle(ORG)).isEqualTo(1);

    final Map<QueueEntryStatus, Integer> counts = queueEntryRepository.countByStatus(ORG);
    assertThat(counts.get(QueueEntryStatus.DIALING)).isEqualTo(1);
    assertThat(counts.get(QueueEntryStatus.QUEUED)).isZero();
  }

  @Test
  void returnToQueueDoesNotCountAttempt() {
    final Instant now = Instant.now();
    final QueueEntryRecord entry =
        queueEntryRepository.upsert(ORG, "lead-1", "+15551230001", null, 0, null, now);
    queueEntryRepository.claimNextBatch(ORG, 1, now);
    queueEntryRepository.markRinging(entry.entryId());

    assertThat(queueEntryRepository.returnToQueue(entry.entryId())).isEqualTo(1);

    final QueueEntryRecord requeued = queueEntryRepository.findById(entry.entryId()).orElseThrow();
    assertThat(requeued.status()).isEqualTo(QueueEntryStatus.QUEUED);
    assertThat(requeued.attemptCount()).isZero();
  }
}
