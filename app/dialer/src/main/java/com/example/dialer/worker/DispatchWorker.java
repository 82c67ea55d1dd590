/*
 * どこで: Dialer 発信ワーカー
 * 何を: 空き担当者と発信待ちリードがある org ごとに発信サイクルを回す
 * なぜ: 担当者が空いた時点で人手を介さず次の一斉発信を始めるため
 */
package com.example.dialer.worker;

import com.example.dialer.repository.QueueEntryRepository;
import com.example.dialer.service.DialerMetrics;
import com.example.dialer.service.DispatchService;
import com.example.dialer.service.RepPoolService;
import lombok.RequiredArgsConstructor;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.scheduling.annotation.Scheduled;
import org.springframework.stereotype.Component;

@Component
@ConditionalOnProperty(name = "dialer.dispatch.enabled", havingValue = "true", matchIfMissing = true)
@RequiredArgsConstructor
public class DispatchWorker {

  private static final Logger logger = LoggerFactory.getLogger(DispatchWorker.class);

  private final DispatchService dispatchService;
  private final RepPoolService repPoolService;
  private final QueueEntryRepository queueEntryRepository;
  private final DialerMetrics metrics;

  @Scheduled(fixedDelayString = "${dialer.dispatch.poll-interval}")
  public void run() {
    metrics.updateQueueDepth(queueEntryRepository.countQueued());
    for (String orgId : repPoolService.findOrgsReadyToDial()) {
      try {
        dispatchService.runCycle(orgId);
      } catch (RuntimeException ex) {
        // 1 org の失敗で他 org の発信を止めない
        logger.warn("dispatch cycle failed orgId={}", orgId, ex);
      }
    }
  }
}
