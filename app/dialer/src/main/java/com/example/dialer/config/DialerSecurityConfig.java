/*
 * どこで: Dialer セキュリティ設定
 * 何を: CRM 向け API は内部トークン、webhook は署名検証で守る
 * なぜ: 呼び出し元ごとに異なる認証方式を 1 つの filter chain にまとめるため
 */
package com.example.dialer.config;

import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.security.config.annotation.web.builders.HttpSecurity;
import org.springframework.security.config.http.SessionCreationPolicy;
import org.springframework.security.web.SecurityFilterChain;
import org.springframework.security.web.access.intercept.AuthorizationFilter;

@Configuration
@EnableConfigurationProperties({DialerInternalApiProperties.class, TelephonyProperties.class})
public class DialerSecurityConfig {

  @Bean
  InternalApiAuthenticationFilter internalApiAuthenticationFilter(
      DialerInternalApiProperties properties) {
    return new InternalApiAuthenticationFilter(properties);
  }

  @Bean
  TelephonySignatureFilter telephonySignatureFilter(TelephonyProperties properties) {
    return new TelephonySignatureFilter(properties);
  }

  @Bean
  SecurityFilterChain securityFilterChain(
      HttpSecurity http,
      InternalApiAuthenticationFilter internalApiAuthenticationFilter,
      TelephonySignatureFilter telephonySignatureFilter)
      throws Exception {
    http.csrf(csrf -> csrf.disable())
        .sessionManagement(
            session -> session.sessionCreationPolicy(SessionCreationPolicy.STATELESS))
        .addFilterBefore(telephonySignatureFilter, AuthorizationFilter.class)
        .addFilterBefore(internalApiAuthenticationFilter, AuthorizationFilter.class)
        .authorizeHttpRequests(
            auth ->
                auth.requestMatchers(
                        "/error",
                        "/actuator/health",
                        "/actuator/health/**",
                        "/actuator/info",
                        "/actuator/prometheus")
                    .permitAll()
                    // webhook は署名 filter で検証済み
                    .requestMatchers("/webhooks/**")
                    .permitAll()
                    .requestMatchers("/v1/**")
                    .hasRole("INTERNAL")
                    .anyRequest()
                    .denyAll());
    return http.build();
  }
}
