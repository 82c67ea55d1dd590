package com.example.dialer.voice;

import java.time.Duration;

/** 保留文言のあと一時停止し、応答 webhook をもう一度呼ばせる。 */
public record HoldAndRetry(String prompt, Duration pause, String redirectUrl)
    implements CallInstruction {}
