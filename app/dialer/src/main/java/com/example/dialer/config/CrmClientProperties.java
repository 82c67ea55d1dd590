/*
 * どこで: Dialer 設定
 * 何を: CRM 本体への内部 API 呼び出し設定を保持する
 * なぜ: 接続先/パス/内部トークンを外部化するため
 */
package com.example.dialer.config;

import org.springframework.boot.context.properties.ConfigurationProperties;

@ConfigurationProperties(prefix = "dialer.crm")
public record CrmClientProperties(
    String baseUrl,
    String assignOwnerPath,
    String callRecordPath,
    String tokenHeaderName,
    String token) {

  public CrmClientProperties {
    baseUrl = baseUrl == null ? "http://crm:80" : baseUrl;
    assignOwnerPath =
        assignOwnerPath == null || assignOwnerPath.isBlank()
            ? "/internal/orgs/{orgId}/leads/{leadId}/owner"
            : assignOwnerPath;
    callRecordPath =
        callRecordPath == null || callRecordPath.isBlank()
            ? "/internal/orgs/{orgId}/calls"
            : callRecordPath;
    tokenHeaderName =
        tokenHeaderName == null || tokenHeaderName.isBlank() ? "X-Internal-Token" : tokenHeaderName;
    token = token == null ? "" : token;
  }
}
