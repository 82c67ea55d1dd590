package com.example.dialer.model;

public enum RepAvailability {
  AVAILABLE,
  CLAIMED
}
