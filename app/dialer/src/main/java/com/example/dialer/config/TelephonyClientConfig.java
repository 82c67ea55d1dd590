/*
 * どこで: Dialer 設定
 * 何を: 通話プロバイダ呼び出し専用 RestClient を提供する
 * なぜ: 下流ごとに baseUrl と認証の責務を分離するため
 */
package com.example.dialer.config;

import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.http.HttpHeaders;
import org.springframework.web.client.RestClient;

@Configuration
public class TelephonyClientConfig {

  @Bean
  RestClient telephonyRestClient(RestClient.Builder builder, TelephonyProperties properties) {
    return builder
        .baseUrl(properties.baseUrl())
        .defaultHeaders(
            headers -> {
              if (!properties.accountId().isBlank()) {
                headers.setBasicAuth(properties.accountId(), properties.authToken());
              }
            })
        .defaultHeader(HttpHeaders.ACCEPT, "application/json")
        .build();
  }
}
