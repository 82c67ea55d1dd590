/*
 * どこで: Dialer 設定
 * 何を: CRM 呼び出し専用 RestClient を提供する
 * なぜ: 下流サービスごとに baseUrl と設定責務を分離するため
 */
package com.example.dialer.config;

import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.web.client.RestClient;

@Configuration
public class CrmClientConfig {

  @Bean
  RestClient crmRestClient(RestClient.Builder builder, CrmClientProperties properties) {
    return builder.baseUrl(properties.baseUrl()).build();
  }
}
