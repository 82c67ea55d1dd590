/*
 * どこで: Dialer ドメインモデル
 * 何を: claim 済みの通話イベント (outbox_events 行) を表す
 * なぜ: Publisher が org と通話 ID をヘッダへ載せられるようにするため
 */
package com.example.dialer.model;

import java.util.UUID;

public record OutboxEventRecord(
    UUID eventId,
    String eventType,
    String orgId,
    String callHandle,
    String payloadJson,
    int attemptCount) {}
