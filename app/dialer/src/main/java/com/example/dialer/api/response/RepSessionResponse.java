package com.example.dialer.api.response;

import com.fasterxml.jackson.databind.PropertyNamingStrategies;
import com.fasterxml.jackson.databind.annotation.JsonNaming;

@JsonNaming(PropertyNamingStrategies.SnakeCaseStrategy.class)
public record RepSessionResponse(
    String sessionId,
    String repId,
    String availability,
    String conferenceName,
    int connectedCallCount,
    String startedAt) {}
