/*
 * どこで: Dialer API
 * 何を: 発信キューへのリード投入リクエストを保持する
 * なぜ: JSON からのバインドと検証を明確にするため
 */
package com.example.dialer.api.request;

import com.fasterxml.jackson.databind.PropertyNamingStrategies;
import com.fasterxml.jackson.databind.annotation.JsonNaming;
import jakarta.validation.Valid;
import jakarta.validation.constraints.NotEmpty;
import jakarta.validation.constraints.Size;
import java.util.List;

@JsonNaming(PropertyNamingStrategies.SnakeCaseStrategy.class)
public record EnqueueLeadsRequest(
    @NotEmpty(message = "leads is required")
        @Size(max = 1000, message = "leads must be at most 1000 items")
        List<@Valid LeadRequest> leads,
    Integer priority,
    String addedBy) {}
