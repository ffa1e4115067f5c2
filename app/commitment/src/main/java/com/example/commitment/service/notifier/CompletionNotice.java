package com.example.commitment.service.notifier;

import java.time.Instant;
import java.util.UUID;

public record CompletionNotice(
    UUID commitmentId,
    String userId,
    String deviceName,
    int durationDays,
    Instant commitmentStart,
    Instant commitmentEnd) {

  public String subject() {
    return "Timer Commitment Complete - " + deviceName;
  }
}
