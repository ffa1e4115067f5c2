/*
 * どこで: Commitment ドメインモデル
 * 何を: 緊急解除リクエスト (emergency_cancellation_requests) の行を表す
 * なぜ: 利用者からの早期解除要請を手動レビューに回すため
 */
package com.example.commitment.model;

import java.time.Instant;
import java.util.UUID;

public record EmergencyCancellationRecord(
    UUID requestId,
    UUID commitmentId,
    String userId,
    String reason,
    String clientIp,
    String userAgent,
    String ticketId,
    Instant createdAt) {}
