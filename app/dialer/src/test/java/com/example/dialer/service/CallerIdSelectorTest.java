package com.example.dialer.service;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import com.example.dialer.config.TelephonyProperties;
import java.util.List;
import org.junit.jupiter.api.Test;

class CallerIdSelectorTest {

  @Test
  void prefersCallerIdWithSameAreaCode() {
    final CallerIdSelector selector =
        selector("+15550000000", List.of("(212) 555-0001", "+14155550002"));

    assertThat(selector.select("+14155550100")).isEqualTo("+14155550002");
    assertThat(selector.select("+12125550100")).isEqualTo("+12125550001");
  }

  @Test
  void fallsBackToDefaultWhenNoAreaCodeMatches() {
    final CallerIdSelector selector = selector("+15550000000", List.of("+14155550002"));

    assertThat(selector.select("+13125550100")).isEqualTo("+15550000000");
    assertThat(selector.select("+81312345678")).isEqualTo("+15550000000");
  }

  @Test
  void usesFirstPoolNumberWithoutDefault() {
    final CallerIdSelector selector = selector(null, List.of("+14155550002", "+12125550001"));

    assertThat(selector.select("+13125550100")).isEqualTo("+14155550002");
  }

  @Test
  void failsWhenNothingIsConfigured() {
    final CallerIdSelector selector = selector(null, List.of("bogus"));

    assertThatThrownBy(() -> selector.select("+13125550100"))
        .isInstanceOf(IllegalStateException.class);
  }

  private static CallerIdSelector selector(String defaultCallerId, List<String> callerIds) {
    return new CallerIdSelector(
        new TelephonyProperties(
            null, "AC-test", "token", null, defaultCallerId, callerIds, null, null, null, false,
            false));
  }
}
