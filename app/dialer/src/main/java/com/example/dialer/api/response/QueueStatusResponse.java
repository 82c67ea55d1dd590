package com.example.dialer.api.response;

import com.fasterxml.jackson.databind.PropertyNamingStrategies;
import com.fasterxml.jackson.databind.annotation.JsonNaming;
import java.util.List;
import java.util.Map;

@JsonNaming(PropertyNamingStrategies.SnakeCaseStrategy.class)
public record QueueStatusResponse(
    String orgId, Map<String, Integer> counts, int availableReps, List<QueueEntrySummary> entries) {}
