package com.example.dialer.telephony;

/** 発信依頼。answerUrl は応答時に音声命令を取りに来る先。 */
public record PlaceCallRequest(String to, String from, String answerUrl, String statusCallbackUrl) {}
