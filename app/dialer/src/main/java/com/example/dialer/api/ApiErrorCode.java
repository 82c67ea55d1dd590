/*
 * どこで: Dialer API
 * 何を: エラー応答のコードを定義する
 * なぜ: 同じ HTTP ステータスでも原因を区別できるようにするため
 */
package com.example.dialer.api;

public enum ApiErrorCode {
  BAD_REQUEST,
  REP_SESSION_NOT_FOUND,
  QUEUE_ENTRY_BUSY
}
