package com.example.commitment.service.notifier;

import java.time.Instant;
import java.util.UUID;

public record ExpiryWarningNotice(
    UUID commitmentId, String userId, String deviceName, Instant commitmentEnd, long hoursLeft) {

  public String subject() {
    return "Timer Expiring Soon - " + hoursLeft + " hours left";
  }
}
