/*
 * どこで: Dialer アプリの設定バインド
 * 何を: 通話終端イベントの outbox publish のポーリング/リトライ設定を保持する
 * なぜ: 運用パラメータを外部化するため
 */
package com.example.dialer.config;

import java.time.Duration;
import org.springframework.boot.context.properties.ConfigurationProperties;

@ConfigurationProperties(prefix = "dialer.outbox")
public record DialerOutboxProperties(
    boolean enabled,
    Duration pollInterval,
    int batchSize,
    int maxAttempts,
    Duration backoffBase,
    Duration backoffMax,
    double backoffExponentBase,
    double backoffJitterMin,
    double backoffJitterMax,
    Duration backoffMin,
    int errorMessageMaxLength,
    Duration lease) {}
