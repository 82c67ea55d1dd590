/*
 * どこで: Dialer 担当者プールのワーカー
 * 何を: 終了済み通話に紐づいたまま残った claim を定期的に解放する
 * なぜ: 会議終了通知の欠落で担当者が発信対象から外れ続けないようにするため
 */
package com.example.dialer.worker;

import com.example.dialer.service.RepPoolService;
import lombok.RequiredArgsConstructor;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.scheduling.annotation.Scheduled;
import org.springframework.stereotype.Component;

@Component
@ConditionalOnProperty(
    name = "dialer.rep-pool.reaper-enabled",
    havingValue = "true",
    matchIfMissing = true)
@RequiredArgsConstructor
public class RepClaimReaperWorker {

  private final RepPoolService repPoolService;

  @Scheduled(fixedDelayString = "${dialer.rep-pool.reaper-interval}")
  public void run() {
    repPoolService.reapStaleClaims();
  }
}
