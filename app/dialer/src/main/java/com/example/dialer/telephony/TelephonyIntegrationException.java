/*
 * どこで: Dialer 通話プロバイダ連携
 * 何を: 発信/キャンセル/会議参加の依頼失敗を表現する
 * なぜ: 呼び出し側で失敗理由ごとに扱いを変えられるようにするため
 */
package com.example.dialer.telephony;

public class TelephonyIntegrationException extends RuntimeException {

  public enum Reason {
    REJECTED,
    NOT_FOUND,
    TIMEOUT,
    INVALID_RESPONSE,
    BAD_GATEWAY
  }

  private final Reason reason;

  public TelephonyIntegrationException(Reason reason, String message) {
    super(message);
    this.reason = reason;
  }

  public TelephonyIntegrationException(Reason reason, String message, Throwable cause) {
    super(message, cause);
    this.reason = reason;
  }

  public Reason reason() {
    return reason;
  }
}
