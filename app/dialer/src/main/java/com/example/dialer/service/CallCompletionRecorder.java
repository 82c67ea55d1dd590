/*
 * どこで: Dialer サービス層
 * 何を: 通話が終端へ遷移した直後の後処理 (キュー反映/接続数/outbox) をまとめる
 * なぜ: 応答 webhook と status webhook のどちらで終端しても同じ処理を同一トランザクションで行うため
 */
package com.example.dialer.service;

import com.example.common.event.CallLifecycleEventPayload;
import com.example.dialer.model.CallAttemptRecord;
import com.example.dialer.model.Disposition;
import com.example.dialer.repository.OutboxEventRepository;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import edu.umd.cs.findbugs.annotations.SuppressFBWarnings;
import java.time.Clock;
import java.time.Instant;
import java.util.UUID;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

@Component
public class CallCompletionRecorder {

  private static final Logger logger = LoggerFactory.getLogger(CallCompletionRecorder.class);
  static final String EVENT_CALL_COMPLETED = "CallCompleted";

  private final QueueService queueService;
  private final RepPoolService repPoolService;
  private final OutboxEventRepository outboxEventRepository;

  @SuppressFBWarnings(
      value = "EI_EXPOSE_REP2",
      justification = "ObjectMapper は Spring 管理の共有コンポーネントで防御的コピーが不可能なため")
  private final ObjectMapper objectMapper;

  private final Clock clock;

  public CallCompletionRecorder(
      QueueService queueService,
      RepPoolService repPoolService,
      OutboxEventRepository outboxEventRepository,
      ObjectMapper objectMapper,
      Clock clock) {
    this.queueService = queueService;
    this.repPoolService = repPoolService;
    this.outboxEventRepository = outboxEventRepository;
    this.objectMapper = objectMapper;
    this.clock = clock;
  }

  /**
   * 役割: 終端遷移した通話の結果を確定する。
   *
   * <p>動作: キューへ結果を反映し、会話があれば担当者の接続数を加算し、CallCompleted を outbox へ積む (通話ごとに 1 件)。
   *
   * <p>前提: 終端遷移が実際に起きた呼び出しでのみ使う。呼び出し側のトランザクションに参加する。
   */
  public void recordTerminal(CallAttemptRecord attempt, Disposition disposition, String traceId) {
    queueService.markOutcome(attempt.queueEntryId(), disposition);
    final int duration = attempt.durationSeconds() == null ? 0 : attempt.durationSeconds();
    if (duration > 0 && attempt.sessionId() != null) {
      repPoolService.incrementConnected(attempt.sessionId());
    }
    final Instant now = Instant.now(clock);
    final UUID eventId = UUID.randomUUID();
    final CallLifecycleEventPayload payload =
        new CallLifecycleEventPayload(
            eventId.toString(),
            EVENT_CALL_COMPLETED,
            now.toString(),
            attempt.orgId(),
            attempt.leadId(),
            attempt.callHandle(),
            attempt.batchId().toString(),
            attempt.status().name(),
            attempt.assignedRepId(),
            duration,
            attempt.recordingUrl(),
            traceId);
    final boolean queued =
        outboxEventRepository.insertCallEvent(
            eventId,
            EVENT_CALL_COMPLETED,
            attempt.orgId(),
            attempt.callHandle(),
            toJson(payload),
            now);
    if (!queued) {
      logger.info("call completed event already queued callHandle={}", attempt.callHandle());
    }
  }

  private String toJson(CallLifecycleEventPayload payload) {
    try {
      return objectMapper.writeValueAsString(payload);
    } catch (JsonProcessingException ex) {
      throw new IllegalStateException("failed to serialize call lifecycle payload", ex);
    }
  }
}
