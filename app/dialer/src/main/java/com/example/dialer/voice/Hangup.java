package com.example.dialer.voice;

/** prompt があれば読み上げてから切断する。 */
public record Hangup(String prompt) implements CallInstruction {

  public static Hangup silently() {
    return new Hangup(null);
  }
}
