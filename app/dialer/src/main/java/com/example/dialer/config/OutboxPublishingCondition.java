/*
 * どこで: Dialer アプリの Bean 条件
 * 何を: outbox 配信と NATS 接続の両方が有効な場合だけ配信系 Bean を登録する
 * なぜ: どちらか一方を止めた環境で JetStream へ触れないため
 */
package com.example.dialer.config;

import org.springframework.boot.autoconfigure.condition.AllNestedConditions;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;

public class OutboxPublishingCondition extends AllNestedConditions {

  public OutboxPublishingCondition() {
    super(ConfigurationPhase.REGISTER_BEAN);
  }

  @ConditionalOnProperty(
      name = "dialer.outbox.enabled",
      havingValue = "true",
      matchIfMissing = true)
  static class OutboxEnabled {}

  @ConditionalOnProperty(name = "nats.enabled", havingValue = "true", matchIfMissing = true)
  static class NatsEnabled {}
}
