package com.example.commitment.service;

public record SweepResult(boolean skipped, int expired, int failed, int warned, int reclaimed) {

  private static final SweepResult SKIPPED = new SweepResult(true, 0, 0, 0, 0);

  public static SweepResult skippedRun() {
    return SKIPPED;
  }

  public boolean hasWork() {
    return expired + failed + warned + reclaimed > 0;
  }
}
