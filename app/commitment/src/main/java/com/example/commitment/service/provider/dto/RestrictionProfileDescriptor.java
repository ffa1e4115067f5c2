package com.example.commitment.service.provider.dto;

import com.example.commitment.model.LockedSettings;
import java.time.Instant;

public record RestrictionProfileDescriptor(
    String name,
    String description,
    int durationDays,
    Instant commitmentEnd,
    LockedSettings lockedSettings) {

  public static RestrictionProfileDescriptor forCommitment(
      int durationDays, Instant commitmentEnd, LockedSettings lockedSettings) {
    return new RestrictionProfileDescriptor(
        "Timer Lock - " + durationDays + " days",
        "Device restrictions active until " + commitmentEnd,
        durationDays,
        commitmentEnd,
        lockedSettings == null ? LockedSettings.allLocked() : lockedSettings);
  }
}
