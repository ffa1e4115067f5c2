/*
 * どこで: Commitment ドメインモデル
 * 何を: timer_commitments テーブルのスナップショットを表す
 * なぜ: 作成/スイープ/API 応答で同じ行表現を共有するため
 */
package com.example.commitment.model;

import java.time.Duration;
import java.time.Instant;
import java.util.UUID;

public record CommitmentRecord(
    UUID commitmentId,
    String userId,
    String deviceId,
    String deviceName,
    String providerDeviceId,
    String subscriptionTier,
    int durationDays,
    Instant commitmentStart,
    Instant commitmentEnd,
    CommitmentStatus status,
    String enforcementReference,
    boolean warningSent,
    LockedSettings lockedSettings,
    Instant createdAt,
    Instant updatedAt) {

  public boolean hasEnforcementReference() {
    return enforcementReference != null && !enforcementReference.isBlank();
  }

  public boolean isDue(Instant now) {
    return !commitmentEnd.isAfter(now);
  }

  public Duration remaining(Instant now) {
    if (isDue(now)) {
      return Duration.ZERO;
    }
    return Duration.between(now, commitmentEnd);
  }
}
