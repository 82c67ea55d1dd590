/*
 * どこで: Dialer ドメインモデル
 * 何を: rep_sessions の 1 行を表す
 * なぜ: 担当者の空き状況と接続実績を API/サービスで扱うため
 */
package com.example.dialer.model;

import java.time.Instant;
import java.util.UUID;

public record RepSessionRecord(
    UUID sessionId,
    String orgId,
    String repId,
    String clientIdentity,
    RepAvailability availability,
    String conferenceName,
    String claimedCallHandle,
    Instant claimedAt,
    Instant lastReleasedAt,
    Instant startedAt,
    int connectedCallCount) {}
