/*
 * どこで: Dialer ドメインモデル
 * 何を: 1 回の発信結果をキューへ反映するための分類を定義する
 * なぜ: リトライ対象か終端かの判定を 1 箇所に寄せるため
 */
package com.example.dialer.model;

public enum Disposition {
  COMPLETED(false),
  MACHINE(false),
  VOICEMAIL(false),
  BUSY(true),
  NO_ANSWER(true),
  FAILED(true);

  private final boolean retryable;

  Disposition(boolean retryable) {
    this.retryable = retryable;
  }

  public boolean retryable() {
    return retryable;
  }
}
