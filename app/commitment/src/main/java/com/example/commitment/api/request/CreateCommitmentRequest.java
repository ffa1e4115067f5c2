/*
 * どこで: Commitment API リクエスト DTO
 * 何を: コミットメント作成 API の入力を定義する
 * なぜ: 受信 JSON を型安全に取り扱うため
 */
package com.example.commitment.api.request;

import com.fasterxml.jackson.databind.PropertyNamingStrategies;
import com.fasterxml.jackson.databind.annotation.JsonNaming;
import jakarta.validation.constraints.NotNull;

@JsonNaming(PropertyNamingStrategies.SnakeCaseStrategy.class)
public record CreateCommitmentRequest(
    @NotNull(message = "duration_days is required") Integer durationDays,
    Boolean confirmUnderstanding) {}
