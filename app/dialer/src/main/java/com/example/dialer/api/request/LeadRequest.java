package com.example.dialer.api.request;

import com.fasterxml.jackson.databind.PropertyNamingStrategies;
import com.fasterxml.jackson.databind.annotation.JsonNaming;
import jakarta.validation.constraints.NotBlank;

@JsonNaming(PropertyNamingStrategies.SnakeCaseStrategy.class)
public record LeadRequest(
    @NotBlank(message = "lead_id is required") String leadId,
    @NotBlank(message = "phone is required") String phone,
    String name) {}
