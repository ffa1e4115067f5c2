/*
 * どこで: Commitment ドメインモデル
 * 何を: コミットメント中に拒否される端末機能の一覧を表す
 * なぜ: 実際の制限はプロバイダに委ねつつ、記録と表示用に固定値を残すため
 */
package com.example.commitment.model;

import com.fasterxml.jackson.annotation.JsonProperty;

public record LockedSettings(
    @JsonProperty("profileRemoval") boolean profileRemoval,
    @JsonProperty("factoryReset") boolean factoryReset,
    @JsonProperty("appInstallation") boolean appInstallation,
    @JsonProperty("systemSettings") boolean systemSettings) {

  private static final LockedSettings ALL_LOCKED = new LockedSettings(false, false, false, false);

  public static LockedSettings allLocked() {
    return ALL_LOCKED;
  }
}
