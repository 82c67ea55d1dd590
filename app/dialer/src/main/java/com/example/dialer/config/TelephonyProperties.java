/*
 * どこで: Dialer 設定
 * 何を: 通話プロバイダ (Twilio 互換 REST) の接続先/認証/発信オプションを保持する
 * なぜ: 発信元番号プールやコールバック URL を環境ごとに切り替えるため
 */
package com.example.dialer.config;

import java.time.Duration;
import java.util.List;
import org.springframework.boot.context.properties.ConfigurationProperties;

@ConfigurationProperties(prefix = "dialer.telephony")
public record TelephonyProperties(
    String baseUrl,
    String accountId,
    String authToken,
    String callbackBaseUrl,
    String defaultCallerId,
    List<String> callerIds,
    String machineDetection,
    Duration machineDetectionTimeout,
    Duration ringTimeout,
    boolean recordCalls,
    boolean validateSignatures) {

  public TelephonyProperties {
    baseUrl = isBlank(baseUrl) ? "https://api.twilio.com/2010-04-01" : baseUrl;
    accountId = accountId == null ? "" : accountId;
    authToken = authToken == null ? "" : authToken;
    callbackBaseUrl = isBlank(callbackBaseUrl) ? "http://localhost:8080" : trimSlash(callbackBaseUrl);
    defaultCallerId = defaultCallerId == null ? "" : defaultCallerId;
    callerIds = callerIds == null ? List.of() : List.copyOf(callerIds);
    machineDetection = isBlank(machineDetection) ? "DetectMessageEnd" : machineDetection;
    machineDetectionTimeout =
        machineDetectionTimeout == null ? Duration.ofSeconds(5) : machineDetectionTimeout;
    ringTimeout = ringTimeout == null ? Duration.ofSeconds(30) : ringTimeout;
  }

  public String callbackUrl(String path) {
    return callbackBaseUrl + path;
  }

  private static String trimSlash(String value) {
    return value.endsWith("/") ? value.substring(0, value.length() - 1) : value;
  }

  private static boolean isBlank(String value) {
    return value == null || value.isBlank();
  }
}
