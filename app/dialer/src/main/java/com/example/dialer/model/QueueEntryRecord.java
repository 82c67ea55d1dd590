/*
 * どこで: Dialer ドメインモデル
 * 何を: queue_entries の 1 行を表す
 * なぜ: 発信待ちリードとリトライ状況を層間で受け渡すため
 */
package com.example.dialer.model;

import java.time.Instant;
import java.util.UUID;

public record QueueEntryRecord(
    UUID entryId,
    String orgId,
    String leadId,
    String leadPhone,
    String leadName,
    int priority,
    QueueEntryStatus status,
    Instant addedAt,
    String addedBy,
    Instant lastAttemptAt,
    Disposition lastDisposition,
    int attemptCount,
    Instant nextAttemptAfter) {}
