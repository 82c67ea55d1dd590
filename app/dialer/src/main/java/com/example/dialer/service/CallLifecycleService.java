/*
 * どこで: Dialer サービス層
 * 何を: 通話 status webhook を call_attempts/queue_entries の状態遷移へ反映する
 * なぜ: 少なくとも 1 回配送される通知を、終端を上書きしない条件付き遷移で冪等に処理するため
 */
package com.example.dialer.service;

import com.example.dialer.model.CallAttemptRecord;
import com.example.dialer.model.ProviderCallStatus;
import com.example.dialer.repository.CallAttemptRepository;
import com.example.dialer.repository.QueueEntryRepository;
import edu.umd.cs.findbugs.annotations.SuppressFBWarnings;
import java.time.Clock;
import java.time.Instant;
import java.util.Optional;
import java.util.UUID;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.dao.DataAccessException;
import org.springframework.stereotype.Service;
import org.springframework.transaction.support.TransactionTemplate;

@Service
public class CallLifecycleService {

  private static final Logger logger = LoggerFactory.getLogger(CallLifecycleService.class);

  private final CallAttemptRepository callAttemptRepository;
  private final QueueEntryRepository queueEntryRepository;
  private final RepPoolService repPoolService;
  private final CallCompletionRecorder completionRecorder;
  private final DialerMetrics metrics;

  @SuppressFBWarnings(
      value = "EI_EXPOSE_REP2",
      justification = "TransactionTemplate は Spring 管理の共有コンポーネントで防御的コピーが不可能なため")
  private final TransactionTemplate transactionTemplate;

  private final Clock clock;

  public CallLifecycleService(
      CallAttemptRepository callAttemptRepository,
      QueueEntryRepository queueEntryRepository,
      RepPoolService repPoolService,
      CallCompletionRecorder completionRecorder,
      DialerMetrics metrics,
      TransactionTemplate transactionTemplate,
      Clock clock) {
    this.callAttemptRepository = callAttemptRepository;
    this.queueEntryRepository = queueEntryRepository;
    this.repPoolService = repPoolService;
    this.completionRecorder = completionRecorder;
    this.metrics = metrics;
    this.transactionTemplate = transactionTemplate;
    this.clock = clock;
  }

  /**
   * 役割: status webhook 1 回分を処理する。
   *
   * <p>動作: 遷移表に従って状態を進め、終端遷移が起きたときだけキュー反映と outbox 登録を行う。
   * 終端通知では再送も含めて毎回担当者の解放を試みる。
   *
   * <p>前提: 例外は投げない。失敗しても webhook は成功応答する。
   */
  public LifecycleOutcome handle(CallStatusEvent event) {
    final String callHandle = event.callHandle();
    Optional<CallAttemptRecord> found = Optional.empty();
    try {
      found = callAttemptRepository.findByCallHandle(callHandle);
      if (found.isEmpty()) {
        logger.info("status for untracked call callHandle={} status={}", callHandle, event.callStatus());
        return track(LifecycleOutcome.UNTRACKED);
      }
      if (isBlank(event.callStatus())) {
        return track(attachRecording(callHandle, event.recordingUrl()));
      }
      final Optional<ProviderCallStatus> status = ProviderCallStatus.fromValue(event.callStatus());
      if (status.isEmpty()) {
        logger.warn("unknown call status callHandle={} status={}", callHandle, event.callStatus());
        return track(LifecycleOutcome.IGNORED);
      }
      final CallAttemptRecord attempt = found.get();
      if (!status.get().isTerminal()) {
        return track(progress(attempt, status.get()));
      }
      final LifecycleOutcome outcome = terminate(attempt, status.get(), event);
      releaseBackstop(attempt);
      return track(outcome);
    } catch (DataAccessException ex) {
      logger.error("status handling failed callHandle={} status={}", callHandle, event.callStatus(), ex);
      found.ifPresent(this::releaseQuietly);
      return track(LifecycleOutcome.FAILED);
    }
  }

  private LifecycleOutcome progress(CallAttemptRecord attempt, ProviderCallStatus status) {
    final Instant now = Instant.now(clock);
    return switch (status.attemptStatus()) {
      case RINGING -> {
        if (callAttemptRepository.markRinging(attempt.callHandle(), now) > 0) {
          queueEntryRepository.markRinging(attempt.queueEntryId());
          yield LifecycleOutcome.PROGRESSED;
        }
        yield LifecycleOutcome.REPLAYED;
      }
      case ANSWERED -> {
        if (callAttemptRepository.markAnswered(attempt.callHandle(), now) > 0) {
          queueEntryRepository.markAnswered(attempt.queueEntryId());
          yield LifecycleOutcome.PROGRESSED;
        }
        yield LifecycleOutcome.REPLAYED;
      }
      default -> LifecycleOutcome.IGNORED;
    };
  }

  private LifecycleOutcome terminate(
      CallAttemptRecord attempt, ProviderCallStatus status, CallStatusEvent event) {
    final Instant now = Instant.now(clock);
    final Boolean transitioned =
        transactionTemplate.execute(
            tx -> {
              final Optional<CallAttemptRecord> ended =
                  callAttemptRepository.markTerminal(
                      attempt.callHandle(),
                      status.attemptStatus(),
                      now,
                      event.durationSeconds(),
                      blankToNull(event.recordingUrl()));
              ended.ifPresent(
                  endedAttempt ->
                      completionRecorder.recordTerminal(
                          endedAttempt, status.disposition(), AnswerService.currentTraceId()));
              return ended.isPresent();
            });
    if (Boolean.TRUE.equals(transitioned)) {
      logger.info(
          "call ended callHandle={} leadId={} status={} duration={}",
          attempt.callHandle(),
          attempt.leadId(),
          status.attemptStatus(),
          event.durationSeconds());
      return LifecycleOutcome.TERMINATED;
    }
    return LifecycleOutcome.REPLAYED;
  }

  private LifecycleOutcome attachRecording(String callHandle, String recordingUrl) {
    if (isBlank(recordingUrl)) {
      return LifecycleOutcome.IGNORED;
    }
    callAttemptRepository.attachRecordingUrl(callHandle, recordingUrl);
    logger.info("call recording attached callHandle={}", callHandle);
    return LifecycleOutcome.RECORDING_ATTACHED;
  }

  private void releaseBackstop(CallAttemptRecord attempt) {
    // 応答時に claim した場合は読み込み時点の行に session がないことがあるため引き直す
    final UUID sessionId =
        attempt.sessionId() != null
            ? attempt.sessionId()
            : callAttemptRepository
                .findByCallHandle(attempt.callHandle())
                .map(CallAttemptRecord::sessionId)
                .orElse(null);
    repPoolService.release(sessionId, attempt.callHandle());
  }

  private void releaseQuietly(CallAttemptRecord attempt) {
    try {
      repPoolService.release(attempt.sessionId(), attempt.callHandle());
    } catch (DataAccessException ex) {
      logger.error("compensating release failed callHandle={}", attempt.callHandle(), ex);
    }
  }

  private LifecycleOutcome track(LifecycleOutcome outcome) {
    metrics.recordWebhook("status", outcome.value());
    return outcome;
  }

  private static String blankToNull(String value) {
    return isBlank(value) ? null : value;
  }

  private static boolean isBlank(String value) {
    return value == null || value.isBlank();
  }
}
