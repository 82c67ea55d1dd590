/*
 * どこで: Dialer ドメインモデル
 * 何を: call_attempts の 1 行 (1 回の発信) を表す
 * なぜ: webhook ごとに call_handle で状態を引き直すため
 */
package com.example.dialer.model;

import java.time.Instant;
import java.util.UUID;

public record CallAttemptRecord(
    String callHandle,
    UUID queueEntryId,
    String orgId,
    String leadId,
    String leadPhone,
    UUID batchId,
    CallAttemptStatus status,
    String callerId,
    String assignedRepId,
    UUID sessionId,
    String conferenceName,
    boolean firstAnswer,
    int claimFailures,
    Instant dialedAt,
    Instant ringingAt,
    Instant answeredAt,
    Instant connectedAt,
    Instant endedAt,
    Integer durationSeconds,
    String recordingUrl,
    String voicemailUrl,
    String voicemailTranscription) {}
