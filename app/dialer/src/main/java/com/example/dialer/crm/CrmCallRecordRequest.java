package com.example.dialer.crm;

import com.fasterxml.jackson.databind.PropertyNamingStrategies;
import com.fasterxml.jackson.databind.annotation.JsonNaming;

@JsonNaming(PropertyNamingStrategies.SnakeCaseStrategy.class)
public record CrmCallRecordRequest(
    String leadId,
    String repId,
    String callHandle,
    String direction,
    String fromNumber,
    String toNumber,
    String status,
    String startedAt,
    String source) {}
