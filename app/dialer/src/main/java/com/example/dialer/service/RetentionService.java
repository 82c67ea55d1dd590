/*
 * どこで: Dialer retention サービス
 * 何を: 終了済みの通話記録と publish 済み outbox を期限で削除する
 * なぜ: テーブル肥大化を防ぎつつ、取り残された通話を検知するため
 */
package com.example.dialer.service;

import com.example.dialer.config.DialerRetentionProperties;
import com.example.dialer.repository.CallAttemptRepository;
import com.example.dialer.repository.OutboxEventRepository;
import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import lombok.RequiredArgsConstructor;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

@Service
@RequiredArgsConstructor
public class RetentionService {

  private static final Logger logger = LoggerFactory.getLogger(RetentionService.class);
  private static final Duration STALE_LIVE_CALL_AFTER = Duration.ofHours(2);

  private final CallAttemptRepository callAttemptRepository;
  private final OutboxEventRepository outboxEventRepository;
  private final DialerRetentionProperties properties;
  private final Clock clock;

  public void cleanup() {
    final Instant now = Instant.now(clock);
    final Instant threshold = now.minus(Duration.ofDays(properties.retentionDays()));
    final int deletedAttempts = callAttemptRepository.deleteFinishedOlderThan(threshold);
    final int deletedOutbox = outboxEventRepository.deletePublishedOlderThan(threshold);
    logger.info(
        "dialer retention cleanup deleted callAttempts={} outboxEvents={} threshold={}",
        deletedAttempts,
        deletedOutbox,
        threshold);
    // 終端通知が届かないまま残った通話は担当者を塞ぐ原因になる
    final int staleLive = callAttemptRepository.countStaleLive(now.minus(STALE_LIVE_CALL_AFTER));
    if (staleLive > 0) {
      logger.error(
          "call attempts stuck in live status count={} olderThan={}",
          staleLive,
          STALE_LIVE_CALL_AFTER);
    }
  }
}
