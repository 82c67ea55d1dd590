/*
 * どこで: common のイベント payload 定義
 * 何を: 通話終端イベントの outbox payload を共通レコードとして提供する
 * なぜ: 後段の通話分析サービスと同一のペイロード形状を共有するため
 */
package com.example.common.event;

import com.fasterxml.jackson.databind.PropertyNamingStrategies;
import com.fasterxml.jackson.databind.annotation.JsonNaming;

@JsonNaming(PropertyNamingStrategies.SnakeCaseStrategy.class)
public record CallLifecycleEventPayload(
    String eventId,
    String eventType,
    String occurredAt,
    String orgId,
    String leadId,
    String callHandle,
    String batchId,
    String finalStatus,
    String assignedRepId,
    long durationSeconds,
    String recordingUrl,
    String traceId) {}
