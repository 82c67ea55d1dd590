/*
 * どこで: Dialer ドメインモデル
 * 何を: 通話プロバイダの留守電検出結果を分類する
 * なぜ: 機械応答なら担当者を確保せずに切断するため
 */
package com.example.dialer.model;

import java.util.Locale;

public enum AnsweredBy {
  HUMAN,
  MACHINE,
  UNKNOWN;

  public static AnsweredBy fromProviderValue(String value) {
    if (value == null || value.isBlank()) {
      return UNKNOWN;
    }
    final String normalized = value.trim().toLowerCase(Locale.ROOT);
    if ("human".equals(normalized)) {
      return HUMAN;
    }
    if ("fax".equals(normalized) || normalized.startsWith("machine_")) {
      return MACHINE;
    }
    return UNKNOWN;
  }
}
