/*
 * どこで: Dialer サービス層
 * 何を: 空き担当者数に応じてリードを取り出し、一斉発信する
 * なぜ: 最初に出た人間へ担当者をつなぎ、残りを取り消す前提の batch を作るため
 */
package com.example.dialer.service;

import com.example.dialer.config.DialerDispatchProperties;
import com.example.dialer.config.TelephonyProperties;
import com.example.dialer.model.Disposition;
import com.example.dialer.model.QueueEntryRecord;
import com.example.dialer.repository.CallAttemptRepository;
import com.example.dialer.repository.QueueEntryRepository;
import com.example.dialer.telephony.PlaceCallRequest;
import com.example.dialer.telephony.TelephonyClient;
import com.example.dialer.telephony.TelephonyIntegrationException;
import java.time.Clock;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.UUID;
import lombok.RequiredArgsConstructor;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.dao.DataAccessException;
import org.springframework.stereotype.Service;

@Service
@RequiredArgsConstructor
public class DispatchService {

  private static final Logger logger = LoggerFactory.getLogger(DispatchService.class);

  static final String ANSWER_PATH = "/webhooks/telephony/answer";
  static final String STATUS_PATH = "/webhooks/telephony/status";

  private final QueueEntryRepository queueEntryRepository;
  private final CallAttemptRepository callAttemptRepository;
  private final RepPoolService repPoolService;
  private final QueueService queueService;
  private final CallerIdSelector callerIdSelector;
  private final TelephonyClient telephonyClient;
  private final TelephonyProperties telephonyProperties;
  private final DialerDispatchProperties properties;
  private final DialerMetrics metrics;
  private final Clock clock;

  /**
   * 役割: org 1 件分の発信サイクルを実行する。
   *
   * <p>動作: 空き担当者数 x fan-out 係数から発信中の通話数を引いた分だけリードを取り出し、同じ batch_id
   * で発信する。
   *
   * <p>前提: 前の batch が鳴っている間は枠が埋まっているので追加発信しない。1 件の発信失敗は残りの発信を止めない。
   */
  public DispatchResult runCycle(String orgId) {
    final int available = repPoolService.countAvailable(orgId);
    if (available == 0) {
      logger.debug("dispatch skipped no reps orgId={}", orgId);
      return DispatchResult.skipped(orgId, DispatchResult.Outcome.NO_REPS, 0, 0);
    }
    final int budget =
        (int) Math.min(properties.maxBatchSize(), (long) available * properties.leadsPerRep());
    final int inFlight = callAttemptRepository.countInFlight(orgId);
    final int requested = budget - inFlight;
    if (requested <= 0) {
      logger.debug(
          "dispatch skipped calls in flight orgId={} inFlight={} budget={}",
          orgId,
          inFlight,
          budget);
      return DispatchResult.skipped(orgId, DispatchResult.Outcome.CALLS_IN_FLIGHT, available, 0);
    }
    final Instant now = Instant.now(clock);
    final List<QueueEntryRecord> entries = queueEntryRepository.claimNextBatch(orgId, requested, now);
    if (entries.isEmpty()) {
      logger.debug("dispatch skipped no leads orgId={}", orgId);
      return DispatchResult.skipped(orgId, DispatchResult.Outcome.NO_LEADS, available, requested);
    }
    final UUID batchId = UUID.randomUUID();
    final List<String> callHandles = new ArrayList<>();
    int failures = 0;
    for (QueueEntryRecord entry : entries) {
      final String callHandle = dial(entry, batchId);
      if (callHandle == null) {
        failures++;
      } else {
        callHandles.add(callHandle);
      }
    }
    metrics.recordDialed(callHandles.size());
    logger.info(
        "dispatch cycle orgId={} batchId={} availableReps={} requested={} dialed={} failures={}",
        orgId,
        batchId,
        available,
        requested,
        callHandles.size(),
        failures);
    return new DispatchResult(
        orgId, batchId, DispatchResult.Outcome.DIALED, available, requested, callHandles, failures);
  }

  private String dial(QueueEntryRecord entry, UUID batchId) {
    final String callerId;
    final String callHandle;
    try {
      callerId = callerIdSelector.select(entry.leadPhone());
      callHandle =
          telephonyClient.placeCall(
              new PlaceCallRequest(
                  entry.leadPhone(),
                  callerId,
                  telephonyProperties.callbackUrl(ANSWER_PATH),
                  telephonyProperties.callbackUrl(STATUS_PATH)));
    } catch (TelephonyIntegrationException | IllegalStateException ex) {
      logger.warn(
          "dial rejected entryId={} leadId={} reason={}",
          entry.entryId(),
          entry.leadId(),
          ex.getMessage());
      metrics.recordDialFailure();
      queueService.markOutcome(entry.entryId(), Disposition.FAILED);
      return null;
    }
    try {
      callAttemptRepository.insertDialing(
          callHandle,
          entry.entryId(),
          entry.orgId(),
          entry.leadId(),
          entry.leadPhone(),
          batchId,
          callerId,
          Instant.now(clock));
      return callHandle;
    } catch (DataAccessException ex) {
      // 追跡できない通話は残さない
      logger.error(
          "call attempt insert failed entryId={} callHandle={}", entry.entryId(), callHandle, ex);
      cancelQuietly(callHandle);
      metrics.recordDialFailure();
      queueService.markOutcome(entry.entryId(), Disposition.FAILED);
      return null;
    }
  }

  private void cancelQuietly(String callHandle) {
    try {
      telephonyClient.cancelCall(callHandle);
    } catch (TelephonyIntegrationException ex) {
      logger.warn("untracked call cancel failed callHandle={} reason={}", callHandle, ex.reason());
    }
  }
}
