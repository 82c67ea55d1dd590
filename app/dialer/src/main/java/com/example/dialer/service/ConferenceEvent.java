package com.example.dialer.service;

/** 会議 status webhook 1 回分の入力。sessionId はコールバック URL のクエリで受け取る。 */
public record ConferenceEvent(
    String sessionId, String statusCallbackEvent, String conferenceName, String callHandle) {}
