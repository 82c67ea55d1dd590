package com.example.dialer.model;

import java.util.EnumSet;
import java.util.Set;

public enum CallAttemptStatus {
  DIALING,
  RINGING,
  ANSWERED,
  MACHINE,
  HOLDING,
  CONNECTED,
  VOICEMAIL,
  COMPLETED,
  BUSY,
  NO_ANSWER,
  FAILED,
  CANCELED;

  private static final Set<CallAttemptStatus> TERMINAL =
      EnumSet.of(MACHINE, COMPLETED, BUSY, NO_ANSWER, FAILED, CANCELED);

  // 終端は sticky。遅れて届いた非終端イベントでは戻さない
  public boolean isTerminal() {
    return TERMINAL.contains(this);
  }

  public static Set<CallAttemptStatus> terminalStatuses() {
    return EnumSet.copyOf(TERMINAL);
  }
}
