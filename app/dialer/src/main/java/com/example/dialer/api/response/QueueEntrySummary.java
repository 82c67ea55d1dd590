package com.example.dialer.api.response;

import com.fasterxml.jackson.databind.PropertyNamingStrategies;
import com.fasterxml.jackson.databind.annotation.JsonNaming;

@JsonNaming(PropertyNamingStrategies.SnakeCaseStrategy.class)
public record QueueEntrySummary(
    String entryId,
    String leadId,
    String leadName,
    String leadPhone,
    int priority,
    String status,
    int attemptCount,
    String lastDisposition,
    String addedAt,
    String lastAttemptAt) {}
