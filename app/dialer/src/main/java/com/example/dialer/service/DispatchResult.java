package com.example.dialer.service;

import java.util.List;
import java.util.UUID;

/** 1 回の発信サイクルの結果。batchId は発信しなかった場合 null。 */
public record DispatchResult(
    String orgId,
    UUID batchId,
    Outcome outcome,
    int availableReps,
    int requested,
    List<String> callHandles,
    int failures) {

  public enum Outcome {
    DIALED,
    NO_REPS,
    CALLS_IN_FLIGHT,
    NO_LEADS
  }

  public DispatchResult {
    callHandles = callHandles == null ? List.of() : List.copyOf(callHandles);
  }

  static DispatchResult skipped(String orgId, Outcome outcome, int availableReps, int requested) {
    return new DispatchResult(orgId, null, outcome, availableReps, requested, List.of(), 0);
  }
}
