package com.example.dialer.api;

public class RepSessionNotFoundException extends RuntimeException {
  public RepSessionNotFoundException(String orgId, String repId) {
    super("rep session not found: org_id=" + orgId + " rep_id=" + repId);
  }
}
