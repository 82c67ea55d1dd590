/*
 * どこで: Dialer のログ設定テスト
 * 何を: JSON ログ設定と MDC/trace フィールド出力の存在を検証する
 * なぜ: org_id/call_handle で通話単位のログを追えなくなる回帰を防ぐため
 */
package com.example.dialer;

import static org.assertj.core.api.Assertions.assertThat;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import org.junit.jupiter.api.Test;
import org.springframework.core.io.ClassPathResource;

class LoggingConfigurationTest {

  @Test
  void logbackConfigurationEmitsJsonWithMdcAndTraceFields() throws IOException {
    final ClassPathResource resource = new ClassPathResource("logback-spring.xml");
    assertThat(resource.exists()).isTrue();

    final String configText =
        new String(resource.getInputStream().readAllBytes(), StandardCharsets.UTF_8);

    assertThat(configText).contains("LoggingEventCompositeJsonEncoder");
    assertThat(configText).contains("\"trace_id\":\"%X{trace_id:-%X{traceId:-}}\"");
    assertThat(configText).contains("\"span_id\":\"%X{span_id:-%X{spanId:-}}\"");
    // request_id/org_id/call_handle は MDC provider 経由で出力される
    assertThat(configText).contains("<mdc>");
    assertThat(configText).contains("defaultValue=\"dialer\"");
    assertThat(configText).contains("<logger name=\"com.example.dialer\"");
  }
}
