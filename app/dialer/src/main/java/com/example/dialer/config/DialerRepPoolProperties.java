/*
 * どこで: Dialer アプリの設定バインド
 * 何を: 担当者 claim の取り残し回収設定を保持する
 * なぜ: release イベント欠落時に担当者が永久に塞がらないようにするため
 */
package com.example.dialer.config;

import java.time.Duration;
import org.springframework.boot.context.properties.ConfigurationProperties;

@ConfigurationProperties(prefix = "dialer.rep-pool")
public record DialerRepPoolProperties(
    Duration staleClaimAfter, boolean reaperEnabled, Duration reaperInterval) {

  public DialerRepPoolProperties {
    staleClaimAfter = staleClaimAfter == null ? Duration.ofMinutes(5) : staleClaimAfter;
    reaperInterval = reaperInterval == null ? Duration.ofMinutes(1) : reaperInterval;
  }
}
