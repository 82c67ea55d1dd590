/*
 * どこで: Dialer アプリの設定バインド
 * 何を: 通話終端イベントの publish 先 subject と JetStream stream 設定を保持する
 * なぜ: publish と重複排除の前提となる stream と保持期間を環境で揃えるため
 */
package com.example.dialer.config;

import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotNull;
import java.time.Duration;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.validation.annotation.Validated;

@Validated
@ConfigurationProperties(prefix = "dialer.nats")
public record DialerNatsProperties(
    @NotBlank String subject,
    @NotBlank String stream,
    @NotNull Duration duplicateWindow,
    Duration maxAge) {

  private static final Duration DEFAULT_MAX_AGE = Duration.ofDays(7);

  public DialerNatsProperties {
    // 分析側が停止していても 1 週間分は読み直せる
    maxAge = maxAge == null ? DEFAULT_MAX_AGE : maxAge;
  }
}
