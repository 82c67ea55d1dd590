/*
 * どこで: Dialer ドメインモデル
 * 何を: 通話プロバイダの status 文字列と内部状態の対応表を持つ
 * なぜ: status callback の遷移を 1 つの表で決めるため
 */
package com.example.dialer.model;

import java.util.Locale;
import java.util.Optional;

public enum ProviderCallStatus {
  QUEUED("queued", CallAttemptStatus.DIALING, null),
  INITIATED("initiated", CallAttemptStatus.DIALING, null),
  RINGING("ringing", CallAttemptStatus.RINGING, null),
  IN_PROGRESS("in-progress", CallAttemptStatus.ANSWERED, null),
  ANSWERED("answered", CallAttemptStatus.ANSWERED, null),
  COMPLETED("completed", CallAttemptStatus.COMPLETED, Disposition.COMPLETED),
  BUSY("busy", CallAttemptStatus.BUSY, Disposition.BUSY),
  NO_ANSWER("no-answer", CallAttemptStatus.NO_ANSWER, Disposition.NO_ANSWER),
  FAILED("failed", CallAttemptStatus.FAILED, Disposition.FAILED),
  // 発信キャンセルはリトライ可能な失敗としてキューへ戻す
  CANCELED("canceled", CallAttemptStatus.CANCELED, Disposition.FAILED);

  private final String value;
  private final CallAttemptStatus attemptStatus;
  private final Disposition disposition;

  ProviderCallStatus(String value, CallAttemptStatus attemptStatus, Disposition disposition) {
    this.value = value;
    this.attemptStatus = attemptStatus;
    this.disposition = disposition;
  }

  public String value() {
    return value;
  }

  public CallAttemptStatus attemptStatus() {
    return attemptStatus;
  }

  public Disposition disposition() {
    return disposition;
  }

  public boolean isTerminal() {
    return attemptStatus.isTerminal();
  }

  public static Optional<ProviderCallStatus> fromValue(String value) {
    if (value == null || value.isBlank()) {
      return Optional.empty();
    }
    final String normalized = value.trim().toLowerCase(Locale.ROOT);
    for (ProviderCallStatus status : values()) {
      if (status.value.equals(normalized)) {
        return Optional.of(status);
      }
    }
    return Optional.empty();
  }
}
