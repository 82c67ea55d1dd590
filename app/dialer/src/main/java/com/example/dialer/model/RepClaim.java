package com.example.dialer.model;

import java.util.UUID;

/** 担当者の確保結果。conferenceName は claim と同じ UPDATE で採番される。 */
public record RepClaim(
    UUID sessionId, String repId, String clientIdentity, String conferenceName) {}
