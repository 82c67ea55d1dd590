package com.example.dialer.voice;

/** リード側の通話を担当者の会議へ合流させる。リード側の入退室では会議を開始/終了しない。 */
public record Bridge(String prompt, String conferenceName, String statusCallbackUrl)
    implements CallInstruction {}
