/*
 * どこで: Commitment サービス層 (プロバイダ連携)
 * 何を: 端末制限プロファイルを作成/配布/削除する MDM プロバイダの契約
 * なぜ: 実 MDM 連携とローカル実装を差し替え可能にするため
 */
package com.example.commitment.service.provider;

import com.example.commitment.service.provider.dto.DeviceInvitation;
import com.example.commitment.service.provider.dto.ProviderDeviceStatus;
import com.example.commitment.service.provider.dto.RestrictionProfileDescriptor;

public interface RestrictionProvider {

  DeviceInvitation createDeviceInvitation(String deviceName, String ownerEmail);

  /** Creates the profile and returns its enforcement reference. */
  String createRestrictionProfile(String providerDeviceId, RestrictionProfileDescriptor descriptor);

  /** Installs an existing profile on the device. Returns the deployment id. */
  String deployProfile(String providerDeviceId, String enforcementReference);

  /** Removes the profile from the device. A profile that is already gone counts as removed. */
  void removeProfile(String providerDeviceId, String enforcementReference);

  ProviderDeviceStatus getDeviceStatus(String providerDeviceId);
}
