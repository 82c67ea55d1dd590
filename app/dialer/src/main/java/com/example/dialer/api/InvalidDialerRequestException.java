/*
 * どこで: Dialer API
 * 何を: リクエスト妥当性エラーを表現する
 * なぜ: バリデーション失敗を 400 へ正規化するため
 */
package com.example.dialer.api;

public class InvalidDialerRequestException extends RuntimeException {
  public InvalidDialerRequestException(String message) {
    super(message);
  }
}
