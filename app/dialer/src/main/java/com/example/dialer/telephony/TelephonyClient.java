/*
 * どこで: Dialer 通話プロバイダ連携
 * 何を: 発信/キャンセル/会議参加/録音開始の境界を定義する
 * なぜ: サービス層をプロバイダ実装から切り離しテストで差し替えるため
 */
package com.example.dialer.telephony;

public interface TelephonyClient {

  /**
   * 役割: 留守電検出付きで発信する。
   * 動作: プロバイダが採番した call_handle を返す。
   * 前提: 拒否された場合は TelephonyIntegrationException を投げる。
   */
  String placeCall(PlaceCallRequest request);

  /** 未応答の発信を取り消す。既に終了済みの通話では例外になりうる。 */
  void cancelCall(String callHandle);

  /** 会議へ参加者を呼び込み、その参加者の call_handle を返す。 */
  String addConferenceParticipant(ConferenceParticipantRequest request);

  void startRecording(String callHandle, String recordingCallbackUrl);
}
