package com.example.dialer.config;

import org.springframework.boot.context.properties.ConfigurationProperties;

@ConfigurationProperties(prefix = "dialer.internal-api")
public record DialerInternalApiProperties(String headerName, String token) {

  public DialerInternalApiProperties {
    headerName = headerName == null || headerName.isBlank() ? "X-Internal-Token" : headerName;
    token = token == null ? "" : token;
  }
}
