/*
 * どこで: Commitment ドメインモデル
 * 何を: timer_commitments.status の有効値を enum で表現する
 * なぜ: DB から読んだ未知の状態値を境界で拒否し、状態遷移を型で扱うため
 */
package com.example.commitment.model;

import java.util.EnumSet;
import java.util.Set;

// DB の CHECK 制約と値を一致させる。PENDING は作成処理中だけ存在する内部状態。
public enum CommitmentStatus {
  PENDING,
  ACTIVE,
  EXPIRED,
  MANUALLY_EXPIRED,
  FAILED;

  private static final Set<CommitmentStatus> TERMINAL =
      EnumSet.of(EXPIRED, MANUALLY_EXPIRED, FAILED);

  public boolean isTerminal() {
    return TERMINAL.contains(this);
  }

  public static CommitmentStatus fromDatabase(String value) {
    if (value == null) {
      throw new IllegalStateException("commitment status is null");
    }
    for (CommitmentStatus status : values()) {
      if (status.name().equals(value)) {
        return status;
      }
    }
    throw new IllegalStateException("unknown commitment status: " + value);
  }
}
