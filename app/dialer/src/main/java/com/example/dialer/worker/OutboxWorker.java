/*
 * どこで: Dialer outbox ワーカー
 * 何を: スケジュールで通話イベントの outbox publish を起動する
 * なぜ: 定期的に未送信イベントを処理するため
 */
package com.example.dialer.worker;

import com.example.dialer.config.OutboxPublishingCondition;
import com.example.dialer.service.CallEventOutboxPublisher;
import lombok.RequiredArgsConstructor;
import org.springframework.context.annotation.Conditional;
import org.springframework.scheduling.annotation.Scheduled;
import org.springframework.stereotype.Component;

@Component
@Conditional(OutboxPublishingCondition.class)
@RequiredArgsConstructor
public class OutboxWorker {

  private final CallEventOutboxPublisher publisher;

  @Scheduled(fixedDelayString = "${dialer.outbox.poll-interval}")
  public void run() {
    publisher.publishPendingBatch();
  }
}
