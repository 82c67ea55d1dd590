/*
 * どこで: Dialer アプリの設定バインド
 * 何を: 発信キューのリトライ上限/クールダウンを保持する
 * なぜ: 再発信ポリシーを環境ごとに調整できるようにするため
 */
package com.example.dialer.config;

import java.time.Duration;
import org.springframework.boot.context.properties.ConfigurationProperties;

@ConfigurationProperties(prefix = "dialer.queue")
public record DialerQueueProperties(int retryLimit, Duration retryCooldown, int statusPageSize) {

  public DialerQueueProperties {
    retryLimit = retryLimit <= 0 ? 3 : retryLimit;
    // ZERO は即時再発信
    retryCooldown = retryCooldown == null ? Duration.ZERO : retryCooldown;
    statusPageSize = statusPageSize <= 0 ? 50 : statusPageSize;
  }
}
