package com.example.dialer.model;

public enum QueueEntryStatus {
  QUEUED,
  DIALING,
  RINGING,
  ANSWERED,
  COMPLETED,
  BUSY,
  NO_ANSWER,
  FAILED;

  // COMPLETED/FAILED は再 enqueue 以外で変更しない
  public boolean isTerminal() {
    return this == COMPLETED || this == FAILED;
  }
}
