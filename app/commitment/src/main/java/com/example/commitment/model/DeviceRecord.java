/*
 * どこで: Commitment ドメインモデル
 * 何を: デバイス台帳から取得した端末情報を表す
 * なぜ: 所有者確認と MDM 登録有無の判定に必要な項目だけを扱うため
 */
package com.example.commitment.model;

public record DeviceRecord(
    String deviceId, String userId, String deviceName, String providerDeviceId) {

  public boolean isEnrolled() {
    return providerDeviceId != null && !providerDeviceId.isBlank();
  }
}
