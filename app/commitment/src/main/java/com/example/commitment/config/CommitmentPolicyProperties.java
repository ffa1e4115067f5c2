/*
 * どこで: Commitment アプリの設定バインド
 * 何を: 要求できるコミットメント日数の絶対的な上下限を保持する
 * なぜ: プラン上限とは別に入力値の形式チェック範囲を固定するため
 */
package com.example.commitment.config;

import jakarta.validation.constraints.Positive;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.validation.annotation.Validated;

@Validated
@ConfigurationProperties(prefix = "commitment.policy")
public record CommitmentPolicyProperties(
    @Positive int minDurationDays, @Positive int maxDurationDays) {}
