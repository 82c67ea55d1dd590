/*
 * どこで: Dialer アプリの設定バインド
 * 何を: 応答時の保留/留守電の音声文言と長さを保持する
 * なぜ: 文言差し替えをコード変更なしで行うため
 */
package com.example.dialer.config;

import java.time.Duration;
import org.springframework.boot.context.properties.ConfigurationProperties;

@ConfigurationProperties(prefix = "dialer.answer")
public record DialerAnswerProperties(
    Duration holdPause,
    Duration voicemailMaxLength,
    String voice,
    String holdPrompt,
    String voicemailPrompt,
    String voicemailMissedPrompt,
    String goodbyePrompt,
    String errorPrompt) {

  public DialerAnswerProperties {
    holdPause = holdPause == null ? Duration.ofSeconds(2) : holdPause;
    voicemailMaxLength = voicemailMaxLength == null ? Duration.ofSeconds(120) : voicemailMaxLength;
    voice = isBlank(voice) ? "alice" : voice;
    holdPrompt = isBlank(holdPrompt) ? "One moment please." : holdPrompt;
    voicemailPrompt =
        isBlank(voicemailPrompt)
            ? "Hi, thanks for answering! All of our representatives are currently busy. "
                + "Please leave a message after the beep and someone will call you back shortly."
            : voicemailPrompt;
    voicemailMissedPrompt =
        isBlank(voicemailMissedPrompt)
            ? "We did not receive your message. Goodbye."
            : voicemailMissedPrompt;
    goodbyePrompt =
        isBlank(goodbyePrompt)
            ? "Thank you for your message. Someone will call you back soon. Goodbye."
            : goodbyePrompt;
    errorPrompt =
        isBlank(errorPrompt)
            ? "Sorry, we are experiencing technical difficulties. Please try again later."
            : errorPrompt;
  }

  private static boolean isBlank(String value) {
    return value == null || value.isBlank();
  }
}
