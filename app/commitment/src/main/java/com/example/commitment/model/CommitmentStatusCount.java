/*
 * どこで: Commitment ドメインモデル
 * 何を: 状態別の件数と平均期間の集計行を表す
 * なぜ: 運用向け統計で孤立したプロバイダ成果物などを検知するため
 */
package com.example.commitment.model;

public record CommitmentStatusCount(CommitmentStatus status, long count, double averageDays) {}
