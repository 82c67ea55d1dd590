/*
 * どこで: Dialer サービス層
 * 何を: 電話番号を E.164 形式へ正規化する
 * なぜ: 発信先と発信元番号の市外局番比較を同じ表記で行うため
 */
package com.example.dialer.service;

import java.util.Optional;

public final class PhoneNumbers {

  private static final int MIN_DIGITS = 10;
  private static final int MAX_DIGITS = 15;

  private PhoneNumbers() {}

  /**
   * 役割: 入力番号を E.164 へ正規化する。
   *
   * <p>動作: 数字以外を除去し、10 桁は北米番号として +1 を補い、1 始まり 11 桁は + を付ける。
   *
   * <p>前提: 桁数が範囲外の番号は空を返す。
   */
  public static Optional<String> toE164(String raw) {
    if (raw == null || raw.isBlank()) {
      return Optional.empty();
    }
    final String digits = raw.replaceAll("\\D", "");
    if (digits.length() < MIN_DIGITS || digits.length() > MAX_DIGITS) {
      return Optional.empty();
    }
    if (digits.length() == 10 && !raw.trim().startsWith("+")) {
      return Optional.of("+1" + digits);
    }
    return Optional.of("+" + digits);
  }

  /** 北米番号の市外局番 (3 桁) を返す。北米以外は空。 */
  public static Optional<String> areaCode(String e164) {
    if (e164 == null || !e164.startsWith("+1") || e164.length() != 12) {
      return Optional.empty();
    }
    return Optional.of(e164.substring(2, 5));
  }
}
