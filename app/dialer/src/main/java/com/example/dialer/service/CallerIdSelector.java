/*
 * どこで: Dialer サービス層
 * 何を: 発信先ごとに発信元番号を選ぶ
 * なぜ: 同じ市外局番の番号を優先して応答率を上げるため
 */
package com.example.dialer.service;

import com.example.dialer.config.TelephonyProperties;
import java.util.List;
import java.util.Optional;
import org.springframework.stereotype.Component;

@Component
public class CallerIdSelector {

  private final TelephonyProperties properties;
  private final List<String> callerIds;

  public CallerIdSelector(TelephonyProperties properties) {
    this.properties = properties;
    this.callerIds =
        properties.callerIds().stream()
            .map(PhoneNumbers::toE164)
            .flatMap(Optional::stream)
            .toList();
  }

  public String select(String leadPhone) {
    final Optional<String> leadArea = PhoneNumbers.areaCode(leadPhone);
    if (leadArea.isPresent()) {
      for (String callerId : callerIds) {
        if (PhoneNumbers.areaCode(callerId).equals(leadArea)) {
          return callerId;
        }
      }
    }
    if (!properties.defaultCallerId().isBlank()) {
      return properties.defaultCallerId();
    }
    if (!callerIds.isEmpty()) {
      return callerIds.get(0);
    }
    throw new IllegalStateException("no caller id configured");
  }
}
