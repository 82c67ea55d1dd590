/*
 * どこで: Dialer サービス層
 * 何を: 通話応答時に担当者を確保して会議へつなぐか、保留/留守電/切断を決める
 * なぜ: 最初に出た人間だけを担当者へつなぎ、同じ batch の残りを取り消すため
 */
package com.example.dialer.service;

import com.example.common.TraceIds;
import com.example.dialer.config.DialerAnswerProperties;
import com.example.dialer.config.TelephonyProperties;
import com.example.dialer.crm.CrmCallRecordRequest;
import com.example.dialer.crm.CrmClient;
import com.example.dialer.crm.CrmIntegrationException;
import com.example.dialer.model.AnsweredBy;
import com.example.dialer.model.CallAttemptRecord;
import com.example.dialer.model.CallAttemptStatus;
import com.example.dialer.model.Disposition;
import com.example.dialer.model.RepClaim;
import com.example.dialer.repository.CallAttemptRepository;
import com.example.dialer.repository.QueueEntryRepository;
import com.example.dialer.telephony.ConferenceParticipantRequest;
import com.example.dialer.telephony.TelephonyClient;
import com.example.dialer.telephony.TelephonyIntegrationException;
import com.example.dialer.voice.Bridge;
import com.example.dialer.voice.CallInstruction;
import com.example.dialer.voice.Hangup;
import com.example.dialer.voice.HoldAndRetry;
import com.example.dialer.voice.RecordVoicemail;
import edu.umd.cs.findbugs.annotations.SuppressFBWarnings;
import java.time.Clock;
import java.time.Instant;
import java.util.List;
import java.util.Optional;
import java.util.UUID;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.slf4j.MDC;
import org.springframework.dao.DataAccessException;
import org.springframework.stereotype.Service;
import org.springframework.transaction.support.TransactionTemplate;

@Service
public class AnswerService {

  private static final Logger logger = LoggerFactory.getLogger(AnswerService.class);

  static final String CONFERENCE_PATH = "/webhooks/telephony/conference";
  static final String VOICEMAIL_PATH = "/webhooks/telephony/voicemail";
  static final String TRANSCRIPTION_PATH = "/webhooks/telephony/voicemail/transcription";
  private static final String CLIENT_PREFIX = "client:";

  private final CallAttemptRepository callAttemptRepository;
  private final QueueEntryRepository queueEntryRepository;
  private final QueueService queueService;
  private final RepPoolService repPoolService;
  private final CallCompletionRecorder completionRecorder;
  private final TelephonyClient telephonyClient;
  private final CrmClient crmClient;
  private final TelephonyProperties telephonyProperties;
  private final DialerAnswerProperties answerProperties;
  private final DialerMetrics metrics;

  @SuppressFBWarnings(
      value = "EI_EXPOSE_REP2",
      justification = "TransactionTemplate は Spring 管理の共有コンポーネントで防御的コピーが不可能なため")
  private final TransactionTemplate transactionTemplate;

  private final Clock clock;

  public AnswerService(
      CallAttemptRepository callAttemptRepository,
      QueueEntryRepository queueEntryRepository,
      QueueService queueService,
      RepPoolService repPoolService,
      CallCompletionRecorder completionRecorder,
      TelephonyClient telephonyClient,
      CrmClient crmClient,
      TelephonyProperties telephonyProperties,
      DialerAnswerProperties answerProperties,
      DialerMetrics metrics,
      TransactionTemplate transactionTemplate,
      Clock clock) {
    this.callAttemptRepository = callAttemptRepository;
    this.queueEntryRepository = queueEntryRepository;
    this.queueService = queueService;
    this.repPoolService = repPoolService;
    this.completionRecorder = completionRecorder;
    this.telephonyClient = telephonyClient;
    this.crmClient = crmClient;
    this.telephonyProperties = telephonyProperties;
    this.answerProperties = answerProperties;
    this.metrics = metrics;
    this.transactionTemplate = transactionTemplate;
    this.clock = clock;
  }

  /**
   * 役割: 応答 webhook 1 回分の判定を行い、プロバイダへ返す指示を決める。
   *
   * <p>動作: 留守電機は切断、担当者を確保できれば会議へ合流、できなければ 1 回だけ保留して再判定し、
   * 2 回目も確保できなければ留守電録音へ進む。
   *
   * <p>前提: 同じ通話の再送では状態に応じて同じ指示を返す。例外は投げず、保存失敗時はエラー文言で切断する。
   */
  public CallInstruction handleAnswer(String callHandle, String answeredByValue) {
    try {
      final Optional<CallAttemptRecord> found = callAttemptRepository.findByCallHandle(callHandle);
      if (found.isEmpty()) {
        logger.warn("answer for untracked call callHandle={}", callHandle);
        metrics.recordAnswerOutcome("untracked");
        return new Hangup(answerProperties.errorPrompt());
      }
      final CallAttemptRecord attempt = found.get();
      if (attempt.status() == CallAttemptStatus.CONNECTED) {
        return bridge(attempt.conferenceName(), attempt.sessionId());
      }
      if (attempt.status() == CallAttemptStatus.VOICEMAIL) {
        return recordVoicemail();
      }
      if (attempt.status().isTerminal()) {
        logger.info(
            "answer for finished call callHandle={} status={}", callHandle, attempt.status());
        return Hangup.silently();
      }
      final AnsweredBy answeredBy = AnsweredBy.fromProviderValue(answeredByValue);
      // 保留中の再判定では留守電機判定をやり直さない
      if (answeredBy == AnsweredBy.MACHINE && attempt.status() != CallAttemptStatus.HOLDING) {
        return handleMachine(attempt);
      }
      return claimAndBridge(attempt);
    } catch (DataAccessException ex) {
      logger.error("answer handling failed callHandle={}", callHandle, ex);
      metrics.recordAnswerOutcome("error");
      return new Hangup(answerProperties.errorPrompt());
    }
  }

  private CallInstruction handleMachine(CallAttemptRecord attempt) {
    final Instant now = Instant.now(clock);
    transactionTemplate.executeWithoutResult(
        status ->
            callAttemptRepository
                .markMachine(attempt.callHandle(), now)
                .ifPresent(
                    machine ->
                        completionRecorder.recordTerminal(
                            machine, Disposition.MACHINE, currentTraceId())));
    logger.info(
        "machine answered callHandle={} leadId={}", attempt.callHandle(), attempt.leadId());
    metrics.recordAnswerOutcome("machine");
    return Hangup.silently();
  }

  private CallInstruction claimAndBridge(CallAttemptRecord attempt) {
    final Instant now = Instant.now(clock);
    // claim と CONNECTED 遷移は同じトランザクション。遷移できなければ claim ごと巻き戻す
    final ClaimResult result =
        transactionTemplate.execute(
            status -> {
              final Optional<RepClaim> claim =
                  repPoolService.claim(attempt.orgId(), attempt.callHandle());
              if (claim.isEmpty()) {
                return ClaimResult.NOT_AVAILABLE;
              }
              final RepClaim rep = claim.get();
              final int updated =
                  callAttemptRepository.markConnected(
                      attempt.callHandle(),
                      rep.repId(),
                      rep.sessionId(),
                      rep.conferenceName(),
                      now);
              if (updated == 0) {
                status.setRollbackOnly();
                return ClaimResult.ATTEMPT_GONE;
              }
              return new ClaimResult(ClaimState.CLAIMED, rep);
            });
    if (result == null || result.state() == ClaimState.ATTEMPT_GONE) {
      return instructionForCurrentState(attempt.callHandle());
    }
    if (result.state() == ClaimState.NOT_AVAILABLE) {
      return handleNoRep(attempt, now);
    }
    final RepClaim rep = result.claim();
    try {
      return onConnected(attempt, rep, now);
    } catch (RuntimeException ex) {
      // claim は commit 済みなので、切断する前に担当者を戻す
      logger.error(
          "bridge setup failed callHandle={} repId={}", attempt.callHandle(), rep.repId(), ex);
      metrics.recordAnswerOutcome("error");
      releaseQuietly(rep, attempt.callHandle());
      return new Hangup(answerProperties.errorPrompt());
    }
  }

  /**
   * 役割: 条件付き遷移に負けた応答 webhook へ、並行処理が確定させた状態に合う指示を返す。
   *
   * <p>前提: 同じ通話の応答が重複して届いても、接続済みの通話を切断しない。
   */
  private CallInstruction instructionForCurrentState(String callHandle) {
    final Optional<CallAttemptRecord> current = callAttemptRepository.findByCallHandle(callHandle);
    if (current.isEmpty() || current.get().status().isTerminal()) {
      logger.info("call ended before bridge callHandle={}", callHandle);
      metrics.recordAnswerOutcome("gone");
      return Hangup.silently();
    }
    final CallAttemptRecord attempt = current.get();
    logger.info(
        "answer settled by concurrent delivery callHandle={} status={}",
        callHandle,
        attempt.status());
    metrics.recordAnswerOutcome("replayed");
    if (attempt.status() == CallAttemptStatus.CONNECTED) {
      return bridge(attempt.conferenceName(), attempt.sessionId());
    }
    if (attempt.status() == CallAttemptStatus.VOICEMAIL) {
      return recordVoicemail();
    }
    return holdAndRetry();
  }

  private CallInstruction handleNoRep(CallAttemptRecord attempt, Instant now) {
    if (attempt.status() == CallAttemptStatus.HOLDING) {
      final Boolean moved =
          transactionTemplate.execute(
              status -> {
                if (callAttemptRepository.markVoicemail(attempt.callHandle()) == 0) {
                  return false;
                }
                queueService.markOutcome(attempt.queueEntryId(), Disposition.VOICEMAIL);
                return true;
              });
      if (!Boolean.TRUE.equals(moved)) {
        return instructionForCurrentState(attempt.callHandle());
      }
      logger.info(
          "no rep after hold, recording voicemail callHandle={} leadId={}",
          attempt.callHandle(),
          attempt.leadId());
      metrics.recordAnswerOutcome("voicemail");
      return recordVoicemail();
    }
    if (callAttemptRepository.markHolding(attempt.callHandle(), now) == 0) {
      return instructionForCurrentState(attempt.callHandle());
    }
    logger.info(
        "no rep available, holding callHandle={} leadId={}", attempt.callHandle(), attempt.leadId());
    metrics.recordAnswerOutcome("holding");
    return holdAndRetry();
  }

  private CallInstruction onConnected(CallAttemptRecord attempt, RepClaim rep, Instant now) {
    logger.info(
        "call connected callHandle={} leadId={} repId={} conference={}",
        attempt.callHandle(),
        attempt.leadId(),
        rep.repId(),
        rep.conferenceName());
    metrics.recordAnswerOutcome("connected");
    metrics.recordAnswerToConnect(attempt.dialedAt(), now);
    recordAnswerBookkeeping(attempt);
    cancelSiblings(attempt, now);
    handOffToCrm(attempt, rep, now);
    joinRep(attempt, rep);
    if (telephonyProperties.recordCalls()) {
      startRecording(attempt);
    }
    return bridge(rep.conferenceName(), rep.sessionId());
  }

  // 接続は確定済み。集計用の印が付かなくても通話は会議へ流す
  private void recordAnswerBookkeeping(CallAttemptRecord attempt) {
    try {
      if (!callAttemptRepository.markFirstAnswer(attempt.callHandle())) {
        logger.info(
            "connected call is not first answer of batch callHandle={} batchId={}",
            attempt.callHandle(),
            attempt.batchId());
      }
      queueEntryRepository.markAnswered(attempt.queueEntryId());
    } catch (DataAccessException ex) {
      logger.warn(
          "answer bookkeeping failed callHandle={} entryId={}",
          attempt.callHandle(),
          attempt.queueEntryId(),
          ex);
    }
  }

  private void cancelSiblings(CallAttemptRecord attempt, Instant now) {
    final List<CallAttemptRecord> siblings;
    try {
      siblings =
          callAttemptRepository.findRingingSiblings(attempt.batchId(), attempt.callHandle());
    } catch (DataAccessException ex) {
      logger.warn("sibling lookup failed batchId={}", attempt.batchId(), ex);
      return;
    }
    int canceled = 0;
    for (CallAttemptRecord sibling : siblings) {
      try {
        // 既に応答済み/終了済みの兄弟は条件付き UPDATE で除外される
        if (callAttemptRepository.markCanceled(sibling.callHandle(), now) == 0) {
          continue;
        }
        queueService.returnToQueue(sibling.queueEntryId());
        canceled++;
        telephonyClient.cancelCall(sibling.callHandle());
      } catch (TelephonyIntegrationException ex) {
        logger.warn(
            "sibling cancel failed callHandle={} reason={}", sibling.callHandle(), ex.reason());
      } catch (DataAccessException ex) {
        logger.warn("sibling cancel store failed callHandle={}", sibling.callHandle(), ex);
      }
    }
    if (canceled > 0) {
      logger.info(
          "batch siblings canceled batchId={} winner={} canceled={}",
          attempt.batchId(),
          attempt.callHandle(),
          canceled);
    }
    metrics.recordSiblingsCanceled(canceled);
  }

  private void handOffToCrm(CallAttemptRecord attempt, RepClaim rep, Instant now) {
    try {
      crmClient.assignLeadOwner(attempt.orgId(), attempt.leadId(), rep.repId());
      crmClient.createCallRecord(
          attempt.orgId(),
          new CrmCallRecordRequest(
              attempt.leadId(),
              rep.repId(),
              attempt.callHandle(),
              "outbound",
              attempt.callerId(),
              attempt.leadPhone(),
              "connected",
              now.toString(),
              "turbo_dialer"));
    } catch (CrmIntegrationException ex) {
      logger.warn(
          "crm handoff failed callHandle={} leadId={} reason={}",
          attempt.callHandle(),
          attempt.leadId(),
          ex.reason());
    }
  }

  private void joinRep(CallAttemptRecord attempt, RepClaim rep) {
    final String identity =
        rep.clientIdentity().startsWith(CLIENT_PREFIX)
            ? rep.clientIdentity()
            : CLIENT_PREFIX + rep.clientIdentity();
    try {
      telephonyClient.addConferenceParticipant(
          new ConferenceParticipantRequest(
              rep.conferenceName(),
              identity,
              attempt.callerId(),
              conferenceCallbackUrl(rep.sessionId())));
    } catch (TelephonyIntegrationException ex) {
      logger.warn(
          "rep join failed repId={} conference={} reason={}",
          rep.repId(),
          rep.conferenceName(),
          ex.reason());
    }
  }

  private void startRecording(CallAttemptRecord attempt) {
    try {
      telephonyClient.startRecording(
          attempt.callHandle(), telephonyProperties.callbackUrl(DispatchService.STATUS_PATH));
    } catch (TelephonyIntegrationException ex) {
      logger.warn(
          "call recording start failed callHandle={} reason={}", attempt.callHandle(), ex.reason());
    }
  }

  private void releaseQuietly(RepClaim rep, String callHandle) {
    try {
      repPoolService.release(rep.sessionId(), callHandle);
    } catch (DataAccessException ex) {
      // 終端 webhook と stale claim の回収が後で戻す
      logger.error(
          "compensating rep release failed sessionId={} callHandle={}",
          rep.sessionId(),
          callHandle,
          ex);
    }
  }

  private HoldAndRetry holdAndRetry() {
    return new HoldAndRetry(
        answerProperties.holdPrompt(),
        answerProperties.holdPause(),
        telephonyProperties.callbackUrl(DispatchService.ANSWER_PATH));
  }

  private Bridge bridge(String conferenceName, UUID sessionId) {
    return new Bridge(
        answerProperties.holdPrompt(), conferenceName, conferenceCallbackUrl(sessionId));
  }

  private RecordVoicemail recordVoicemail() {
    return new RecordVoicemail(
        answerProperties.voicemailPrompt(),
        answerProperties.voicemailMaxLength(),
        telephonyProperties.callbackUrl(VOICEMAIL_PATH),
        telephonyProperties.callbackUrl(TRANSCRIPTION_PATH),
        answerProperties.voicemailMissedPrompt());
  }

  private String conferenceCallbackUrl(UUID sessionId) {
    return telephonyProperties.callbackUrl(CONFERENCE_PATH + "?session_id=" + sessionId);
  }

  static String currentTraceId() {
    return TraceIds.resolveOrNew(MDC.get("request_id"));
  }

  private enum ClaimState {
    CLAIMED,
    NOT_AVAILABLE,
    ATTEMPT_GONE
  }

  private record ClaimResult(ClaimState state, RepClaim claim) {
    static final ClaimResult NOT_AVAILABLE = new ClaimResult(ClaimState.NOT_AVAILABLE, null);
    static final ClaimResult ATTEMPT_GONE = new ClaimResult(ClaimState.ATTEMPT_GONE, null);
  }
}
