/*
 * どこで: Commitment API レスポンス DTO
 * 何を: 作成/取得 API が返すコミットメントの表現を定義する
 * なぜ: 作成直後と参照時で同じ構造を返すため
 */
package com.example.commitment.api.response;

import com.example.commitment.model.CommitmentRecord;
import com.example.commitment.model.LockedSettings;
import com.fasterxml.jackson.databind.PropertyNamingStrategies;
import com.fasterxml.jackson.databind.annotation.JsonNaming;

@JsonNaming(PropertyNamingStrategies.SnakeCaseStrategy.class)
public record CommitmentResponse(
    String commitmentId,
    String userId,
    String deviceId,
    String deviceName,
    int durationDays,
    String commitmentStart,
    String commitmentEnd,
    String status,
    String subscriptionTier,
    LockedSettings lockedSettings) {

  public static CommitmentResponse from(CommitmentRecord record) {
    return new CommitmentResponse(
        record.commitmentId().toString(),
        record.userId(),
        record.deviceId(),
        record.deviceName(),
        record.durationDays(),
        record.commitmentStart().toString(),
        record.commitmentEnd().toString(),
        record.status().name(),
        record.subscriptionTier(),
        record.lockedSettings());
  }
}
