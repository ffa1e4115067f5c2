/*
 * どこで: Commitment ドメインモデル
 * 何を: commitment_audit テーブル相当の監査レコード
 * なぜ: 管理者による強制終了の根拠を後から追跡できるようにするため
 */
package com.example.commitment.model;

import java.time.Instant;
import java.util.UUID;

public record CommitmentAuditRecord(
    UUID auditId,
    UUID commitmentId,
    String actorUserId,
    String action,
    String reason,
    String detailJson,
    Instant createdAt) {}
