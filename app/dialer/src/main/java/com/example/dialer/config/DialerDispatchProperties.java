/*
 * どこで: Dialer アプリの設定バインド
 * 何を: 一斉発信の fan-out 係数とポーリング間隔を保持する
 * なぜ: 空き担当者数に対する同時発信数を運用で調整するため
 */
package com.example.dialer.config;

import java.time.Duration;
import org.springframework.boot.context.properties.ConfigurationProperties;

@ConfigurationProperties(prefix = "dialer.dispatch")
public record DialerDispatchProperties(
    boolean enabled, Duration pollInterval, int leadsPerRep, int maxBatchSize) {

  public DialerDispatchProperties {
    pollInterval = pollInterval == null ? Duration.ofSeconds(5) : pollInterval;
    leadsPerRep = leadsPerRep <= 0 ? 3 : leadsPerRep;
    maxBatchSize = maxBatchSize <= 0 ? 30 : maxBatchSize;
  }
}
