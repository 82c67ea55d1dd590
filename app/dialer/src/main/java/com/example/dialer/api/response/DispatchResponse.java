package com.example.dialer.api.response;

import com.fasterxml.jackson.databind.PropertyNamingStrategies;
import com.fasterxml.jackson.databind.annotation.JsonNaming;
import java.util.List;

@JsonNaming(PropertyNamingStrategies.SnakeCaseStrategy.class)
public record DispatchResponse(
    String batchId,
    String result,
    int availableReps,
    int requested,
    List<String> callHandles,
    int failures) {}
