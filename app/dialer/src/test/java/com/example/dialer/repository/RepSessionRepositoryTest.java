/*
 * どこで: Dialer テスト
 * 何を: Postgres での担当者 claim/release の排他を検証する
 * なぜ: 1 担当者が同時に 2 通話へ割り当てられないことを実 DB の並行実行で確かめるため
 */
package com.example.dialer.repository;

import static org.assertj.core.api.Assertions.assertThat;

import com.example.dialer.AbstractPostgresContainerTest;
import com.example.dialer.model.RepAvailability;
import com.example.dialer.model.RepClaim;
import com.example.dialer.model.RepSessionRecord;
import java.time.Duration;
import java.time.Instant;
import java.time.temporal.ChronoUnit;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;
import java.util.UUID;
import java.util.concurrent.Callable;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.context.SpringBootTest;
import org.springframework.jdbc.core.namedparam.MapSqlParameterSource;
import org.springframework.jdbc.core.namedparam.NamedParameterJdbcTemplate;
import org.springframework.test.context.ActiveProfiles;

@SpringBootTest
@ActiveProfiles("test")
class RepSessionRepositoryTest extends AbstractPostgresContainerTest {

  private static final String ORG = "org-rep";

  @Autowired private RepSessionRepository repSessionRepository;

  @Autowired private QueueEntryRepository queueEntryRepository;

  @Autowired private CallAttemptRepository callAttemptRepository;

  @Autowired private NamedParameterJdbcTemplate jdbcTemplate;

  @BeforeEach
  void cleanup() {
    jdbcTemplate.update("DELETE FROM call_attempts", new MapSqlParameterSource());
    jdbcTemplate.update("DELETE FROM queue_entries", new MapSqlParameterSource());
    jdbcTemplate.update("DELETE FROM rep_sessions", new MapSqlParameterSource());
  }

  @Test
  void concurrentClaimsOnSingleRepYieldExactlyOneWinner() throws Exception {
    final Instant now = Instant.now().truncatedTo(ChronoUnit.MILLIS);
    repSessionRepository.upsert(ORG, "rep-1", "rep-1-client", now);

    final int threads = 8;
    final ExecutorService executor = Executors.newFixedThreadPool(threads);
    final CountDownLatch start = new CountDownLatch(1);
    final List<Future<Optional<RepClaim>>> futures = new ArrayList<>();
    try {
      for (int i = 0; i < threads; i++) {
        final String callHandle = "CA-concurrent-" + i;
        final Callable<Optional<RepClaim>> task =
            () -> {
              start.await();
              return repSessionRepository.claimAvailable(ORG, callHandle, "1", now);
            };
        futures.add(executor.submit(task));
      }
      start.countDown();
      int winners = 0;
      for (Future<Optional<RepClaim>> future : futures) {
        if (future.get(30, TimeUnit.SECONDS).isPresent()) {
          winners++;
        }
      }
      assertThat(winners).isEqualTo(1);
    } finally {
      executor.shutdownNow();
    }

    final RepSessionRecord session = repSessionRepository.findByOrg(ORG).get(0);
    assertThat(session.availability()).isEqualTo(RepAvailability.CLAIMED);
    assertThat(session.claimedCallHandle()).startsWith("CA-concurrent-");
  }

  @Test
  void claimReturnsEmptyImmediatelyWhenNoRepIsAvailable() {
    final Instant now = Instant.now();

    final long startedAt = System.nanoTime();
    final Optional<RepClaim> claim = repSessionRepository.claimAvailable(ORG, "CA-none", "1", now);
    final Duration elapsed = Duration.ofNanos(System.nanoTime() - startedAt);

    assertThat(claim).isEmpty();
    assertThat(elapsed).isLessThan(Duration.ofSeconds(5));
  }

  @Test
  void claimPrefersRepIdleTheLongest() {
    final Instant now = Instant.now().truncatedTo(ChronoUnit.MILLIS);
    final RepSessionRecord first = repSessionRepository.upsert(ORG, "rep-a", "a", now);
    final RepSessionRecord second =
        repSessionRepository.upsert(ORG, "rep-b", "b", now.plusSeconds(1));

    // rep-a は直前に通話を終えたばかり、rep-b は開始以来未使用
    repSessionRepository.claimAvailable(ORG, "CA-warmup", "1", now);
    assertThat(repSessionRepository.release(first.sessionId(), "CA-warmup", now.plusSeconds(5)))
        .isEqualTo(1);

    final RepClaim claim =
        repSessionRepository.claimAvailable(ORG, "CA-next", "2", now.plusSeconds(6)).orElseThrow();

    assertThat(claim.sessionId()).isEqualTo(second.sessionId());
    assertThat(claim.conferenceName()).isEqualTo("turbo-" + ORG + "-rep-b-2");
  }

  @Test
  void releaseIgnoresForeignCallHandle() {
    final Instant now = Instant.now();
    final RepSessionRecord session = repSessionRepository.upsert(ORG, "rep-1", "c", now);
    repSessionRepository.claimAvailable(ORG, "CA-owner", "1", now);

    assertThat(repSessionRepository.release(session.sessionId(), "CA-other", now)).isZero();
    assertThat(repSessionRepository.release(session.sessionId(), "CA-owner", now)).isEqualTo(1);
    // 2 回目の解放は何もしない
    assertThat(repSessionRepository.release(session.sessionId(), "CA-owner", now)).isZero();
    assertThat(repSessionRepository.countAvailable(ORG)).isEqualTo(1);
  }

  @Test
  void upsertKeepsClaimStateOfExistingSession() {
    final Instant now = Instant.now();
    final RepSessionRecord opened = repSessionRepository.upsert(ORG, "rep-1", "old", now);
    repSessionRepository.claimAvailable(ORG, "CA-live", "1", now);

    final RepSessionRecord reopened = repSessionRepository.upsert(ORG, "rep-1", "new", now);

    assertThat(reopened.sessionId()).isEqualTo(opened.sessionId());
    assertThat(reopened.availability()).isEqualTo(RepAvailability.CLAIMED);
    assertThat(reopened.clientIdentity()).isEqualTo("new");
  }

  @Test
  void releaseStaleClaimsSkipsClaimsWithLiveCall() {
    final Instant now = Instant.now().truncatedTo(ChronoUnit.MILLIS);
    final Instant old = now.minus(Duration.ofMinutes(10));
    repSessionRepository.upsert(ORG, "rep-live", "live", old);
    repSessionRepository.upsert(ORG, "rep-stale", "stale", old.plusSeconds(1));
    final var entry = queueEntryRepository.upsert(ORG, "lead-1", "+15551230001", null, 0, null, old);
    callAttemptRepository.insertDialing(
        "CA-live", entry.entryId(), ORG, "lead-1", "+15551230001", UUID.randomUUID(), null, old);
    repSessionRepository.claimAvailable(ORG, "CA-live", "1", old);
    repSessionRepository.claimAvailable(ORG, "CA-gone", "2", old);

    final List<RepSessionRecord> released =
        repSessionRepository.releaseStaleClaims(now.minus(Duration.ofMinutes(5)), now);

    assertThat(released).extracting(RepSessionRecord::repId).containsExactly("rep-stale");
    assertThat(repSessionRepository.countAvailable(ORG)).isEqualTo(1);
  }

  @Test
  void findOrgsReadyToDialRequiresRepAndQueuedLead() {
    final Instant now = Instant.now();
    repSessionRepository.upsert("org-ready", "rep-1", "c", now);
    queueEntryRepository.upsert("org-ready", "lead-1", "+15551230001", null, 0, null, now);
    repSessionRepository.upsert("org-no-leads", "rep-1", "c", now);
    queueEntryRepository.upsert("org-no-reps", "lead-1", "+15551230001", null, 0, null, now);

    assertThat(repSessionRepository.findOrgsReadyToDial(now)).containsExactly("org-ready");
  }
}
