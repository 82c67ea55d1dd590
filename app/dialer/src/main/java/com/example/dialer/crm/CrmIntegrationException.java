/*
 * どこで: Dialer CRM 連携
 * 何を: CRM 下流呼び出し失敗を表現する
 * なぜ: 接続後の引き継ぎ失敗を理由別にログへ残すため
 */
package com.example.dialer.crm;

public class CrmIntegrationException extends RuntimeException {

  public enum Reason {
    FORBIDDEN,
    NOT_FOUND,
    TIMEOUT,
    BAD_GATEWAY
  }

  private final Reason reason;

  public CrmIntegrationException(Reason reason, String message, Throwable cause) {
    super(message, cause);
    this.reason = reason;
  }

  public Reason reason() {
    return reason;
  }
}
