package com.example.dialer.config;

import static org.assertj.core.api.Assertions.assertThat;

import java.util.Map;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.Test;
import org.slf4j.MDC;
import org.springframework.mock.web.MockHttpServletRequest;
import org.springframework.mock.web.MockHttpServletResponse;
import org.springframework.web.servlet.HandlerMapping;

class RequestMdcInterceptorTest {

  private final RequestMdcInterceptor interceptor = new RequestMdcInterceptor();

  @AfterEach
  void cleanup() {
    MDC.clear();
  }

  @Test
  void putAndRemoveMdcValuesAroundApiRequest() {
    final MockHttpServletRequest request =
        new MockHttpServletRequest("POST", "/v1/orgs/org-1/queue/entries");
    request.addHeader("X-Request-Id", "req-1");
    request.addHeader("X-Forwarded-For", "10.0.0.1, 10.0.0.2");
    request.setAttribute(
        HandlerMapping.URI_TEMPLATE_VARIABLES_ATTRIBUTE, Map.of("org_id", "org-1"));
    final MockHttpServletResponse response = new MockHttpServletResponse();

    assertThat(interceptor.preHandle(request, response, new Object())).isTrue();

    assertThat(MDC.get("request_id")).isEqualTo("req-1");
    assertThat(MDC.get("http_method")).isEqualTo("POST");
    assertThat(MDC.get("client_ip")).isEqualTo("10.0.0.1");
    assertThat(MDC.get("org_id")).isEqualTo("org-1");
    assertThat(MDC.get("call_handle")).isNull();

    interceptor.afterCompletion(request, response, new Object(), null);

    assertThat(MDC.get("request_id")).isNull();
    assertThat(MDC.get("org_id")).isNull();
  }

  @Test
  void webhookRequestCarriesCallHandle() {
    final MockHttpServletRequest request =
        new MockHttpServletRequest("POST", "/webhooks/telephony/status");
    request.addParameter("CallSid", "CA-1");
    request.setRemoteAddr("203.0.113.5");
    final MockHttpServletResponse response = new MockHttpServletResponse();

    interceptor.preHandle(request, response, new Object());

    assertThat(MDC.get("call_handle")).isEqualTo("CA-1");
    assertThat(MDC.get("client_ip")).isEqualTo("203.0.113.5");
    assertThat(MDC.get("request_id")).isNotBlank();

    interceptor.afterCompletion(request, response, new Object(), null);

    assertThat(MDC.get("call_handle")).isNull();
  }
}
