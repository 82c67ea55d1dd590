package com.example.dialer.service;

/** 通話 status webhook 1 回分の入力。callStatus が空なら録音完了通知として扱う。 */
public record CallStatusEvent(
    String callHandle,
    String callStatus,
    String answeredBy,
    Integer durationSeconds,
    String recordingUrl) {}
