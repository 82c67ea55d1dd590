/*
 * Where: Dialer application configuration binding
 * What: Holds retention cleanup settings for finished call attempts and outbox rows
 * Why: Keep retention policy and schedule tunable per environment
 */
package com.example.dialer.config;

import java.time.Duration;
import org.springframework.boot.context.properties.ConfigurationProperties;

@ConfigurationProperties(prefix = "dialer.retention")
public record DialerRetentionProperties(
    boolean enabled, int retentionDays, Duration cleanupInterval) {}
