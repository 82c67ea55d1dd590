package com.example.dialer.service;

import java.util.Locale;

public enum LifecycleOutcome {
  UNTRACKED,
  IGNORED,
  PROGRESSED,
  TERMINATED,
  REPLAYED,
  RECORDING_ATTACHED,
  FAILED;

  public String value() {
    return name().toLowerCase(Locale.ROOT);
  }
}
