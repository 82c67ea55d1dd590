package com.example.dialer.api;

public class QueueEntryBusyException extends RuntimeException {
  public QueueEntryBusyException(String leadId) {
    super("lead is being dialed: lead_id=" + leadId);
  }
}
