package com.example.dialer.telephony;

/** 担当者のソフトフォンを会議へ呼び込む依頼。担当者側の入退室で会議の開始/終了が決まる。 */
public record ConferenceParticipantRequest(
    String conferenceName, String to, String from, String statusCallbackUrl) {}
