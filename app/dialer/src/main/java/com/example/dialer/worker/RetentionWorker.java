/*
 * どこで: Dialer retention ワーカー
 * 何を: retention cleanup をスケジュールで起動する
 * なぜ: 手動介入なしで期限切れ削除を回すため
 */
package com.example.dialer.worker;

import com.example.dialer.service.RetentionService;
import lombok.RequiredArgsConstructor;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.scheduling.annotation.Scheduled;
import org.springframework.stereotype.Component;

@Component
@RequiredArgsConstructor
@ConditionalOnProperty(name = "dialer.retention.enabled", havingValue = "true")
public class RetentionWorker {

  private final RetentionService retentionService;

  @Scheduled(fixedDelayString = "${dialer.retention.cleanup-interval}")
  public void run() {
    retentionService.cleanup();
  }
}
