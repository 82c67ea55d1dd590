/*
 * どこで: Dialer サービス層
 * 何を: 担当者セッションの開閉と claim/release を担う
 * なぜ: 担当者を同時に 1 通話だけへ割り当てる排他を一箇所で扱うため
 */
package com.example.dialer.service;

import com.example.dialer.api.InvalidDialerRequestException;
import com.example.dialer.api.RepSessionNotFoundException;
import com.example.dialer.api.request.OpenRepSessionRequest;
import com.example.dialer.api.response.RepSessionResponse;
import com.example.dialer.config.DialerRepPoolProperties;
import com.example.dialer.model.RepClaim;
import com.example.dialer.model.RepSessionRecord;
import com.example.dialer.repository.RepSessionRepository;
import java.time.Clock;
import java.time.Instant;
import java.util.List;
import java.util.Optional;
import java.util.UUID;
import lombok.RequiredArgsConstructor;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

@Service
@RequiredArgsConstructor
public class RepPoolService {

  private static final Logger logger = LoggerFactory.getLogger(RepPoolService.class);

  private final RepSessionRepository repSessionRepository;
  private final DialerRepPoolProperties properties;
  private final DialerMetrics metrics;
  private final Clock clock;

  public RepSessionResponse openSession(String orgId, String repId, OpenRepSessionRequest request) {
    requireText(orgId, "org_id");
    requireText(repId, "rep_id");
    final RepSessionRecord record =
        repSessionRepository.upsert(orgId, repId, request.clientIdentity(), Instant.now(clock));
    logger.info(
        "rep session opened orgId={} repId={} sessionId={} availability={}",
        orgId,
        repId,
        record.sessionId(),
        record.availability());
    return toResponse(record);
  }

  public RepSessionResponse closeSession(String orgId, String repId) {
    requireText(orgId, "org_id");
    requireText(repId, "rep_id");
    final RepSessionRecord record =
        repSessionRepository
            .delete(orgId, repId)
            .orElseThrow(() -> new RepSessionNotFoundException(orgId, repId));
    logger.info(
        "rep session closed orgId={} repId={} sessionId={} connected={}",
        orgId,
        repId,
        record.sessionId(),
        record.connectedCallCount());
    return toResponse(record);
  }

  /**
   * 役割: 空いている担当者を 1 人確保する。
   *
   * <p>動作: 最も長く空いている担当者を 1 文で CLAIMED にし、会議名を割り当てる。
   *
   * <p>前提: 空きがなければ待たずに空を返す。呼び出し側のトランザクションに参加する。
   */
  public Optional<RepClaim> claim(String orgId, String callHandle) {
    final Instant now = Instant.now(clock);
    final Optional<RepClaim> claim =
        repSessionRepository.claimAvailable(
            orgId, callHandle, Long.toString(now.toEpochMilli()), now);
    metrics.recordRepClaim(claim.isPresent() ? "claimed" : "not_available");
    return claim;
  }

  /** claim した通話と一致する場合だけ解放する。戻り値は解放したかどうか。 */
  public boolean release(UUID sessionId, String callHandle) {
    if (sessionId == null || callHandle == null) {
      return false;
    }
    final boolean released =
        repSessionRepository.release(sessionId, callHandle, Instant.now(clock)) > 0;
    if (released) {
      logger.info("rep released sessionId={} callHandle={}", sessionId, callHandle);
    }
    return released;
  }

  public boolean releaseConference(UUID sessionId, String conferenceName) {
    if (sessionId == null || conferenceName == null) {
      return false;
    }
    final boolean released =
        repSessionRepository.releaseConference(sessionId, conferenceName, Instant.now(clock)) > 0;
    if (released) {
      logger.info("rep released by conference end sessionId={} conference={}", sessionId, conferenceName);
    }
    return released;
  }

  public void incrementConnected(UUID sessionId) {
    if (sessionId != null) {
      repSessionRepository.incrementConnected(sessionId);
    }
  }

  public int countAvailable(String orgId) {
    return repSessionRepository.countAvailable(orgId);
  }

  public List<String> findOrgsReadyToDial() {
    return repSessionRepository.findOrgsReadyToDial(Instant.now(clock));
  }

  /** release 通知を取りこぼした claim を回収する。 */
  public int reapStaleClaims() {
    final Instant now = Instant.now(clock);
    final List<RepSessionRecord> released =
        repSessionRepository.releaseStaleClaims(now.minus(properties.staleClaimAfter()), now);
    for (RepSessionRecord record : released) {
      logger.warn(
          "stale rep claim released orgId={} repId={} sessionId={}",
          record.orgId(),
          record.repId(),
          record.sessionId());
    }
    metrics.recordStaleClaimsReleased(released.size());
    return released.size();
  }

  private RepSessionResponse toResponse(RepSessionRecord record) {
    return new RepSessionResponse(
        record.sessionId().toString(),
        record.repId(),
        record.availability().name(),
        record.conferenceName(),
        record.connectedCallCount(),
        record.startedAt() == null ? null : record.startedAt().toString());
  }

  private static void requireText(String value, String field) {
    if (value == null || value.isBlank()) {
      throw new InvalidDialerRequestException(field + " is required");
    }
  }
}
