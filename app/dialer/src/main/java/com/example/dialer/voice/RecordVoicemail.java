package com.example.dialer.voice;

import java.time.Duration;

/** 留守電を文字起こし付きで録音する。録音されなかった場合は missedPrompt を読んで終わる。 */
public record RecordVoicemail(
    String prompt,
    Duration maxLength,
    String recordingActionUrl,
    String transcriptionCallbackUrl,
    String missedPrompt)
    implements CallInstruction {}
