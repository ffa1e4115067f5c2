/*
 * どこで: Commitment サービス層 (プロバイダ連携)
 * 何を: MDM なしで動くインメモリのプロバイダ実装
 * なぜ: ローカル起動と結合テストで実プロバイダなしに作成/期限切れを通すため
 */
package com.example.commitment.service.provider;

import com.example.commitment.service.ExternalErrorKind;
import com.example.commitment.service.provider.dto.DeviceInvitation;
import com.example.commitment.service.provider.dto.ProviderDeviceStatus;
import com.example.commitment.service.provider.dto.RestrictionProfileDescriptor;
import com.google.common.annotations.VisibleForTesting;
import java.time.Clock;
import java.time.Instant;
import java.util.Map;
import java.util.UUID;
import java.util.concurrent.ConcurrentHashMap;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.stereotype.Service;

@Service
@ConditionalOnProperty(name = "commitment.provider.type", havingValue = "local")
public class LocalRestrictionProvider implements RestrictionProvider {

  private static final Logger logger = LoggerFactory.getLogger(LocalRestrictionProvider.class);

  private final Clock clock;
  // profileId -> providerDeviceId
  private final Map<String, String> profiles = new ConcurrentHashMap<>();
  private final Map<String, String> deployed = new ConcurrentHashMap<>();

  public LocalRestrictionProvider(Clock clock) {
    this.clock = clock;
  }

  @Override
  public DeviceInvitation createDeviceInvitation(String deviceName, String ownerEmail) {
    final String id = UUID.randomUUID().toString();
    return new DeviceInvitation(id, "https://enroll.local/" + id, id.substring(0, 8));
  }

  @Override
  public String createRestrictionProfile(
      String providerDeviceId, RestrictionProfileDescriptor descriptor) {
    final String profileId = "local-" + UUID.randomUUID();
    profiles.put(profileId, providerDeviceId);
    logger.info(
        "local profile created providerDeviceId={} profileId={} name={}",
        providerDeviceId,
        profileId,
        descriptor.name());
    return profileId;
  }

  @Override
  public String deployProfile(String providerDeviceId, String enforcementReference) {
    if (!providerDeviceId.equals(profiles.get(enforcementReference))) {
      throw new ProviderIntegrationException(
          ExternalErrorKind.REJECTED, "profile not found for device");
    }
    deployed.put(enforcementReference, providerDeviceId);
    return "deploy-" + enforcementReference;
  }

  @Override
  public void removeProfile(String providerDeviceId, String enforcementReference) {
    deployed.remove(enforcementReference);
    profiles.remove(enforcementReference);
    logger.info(
        "local profile removed providerDeviceId={} profileId={}",
        providerDeviceId,
        enforcementReference);
  }

  @Override
  public ProviderDeviceStatus getDeviceStatus(String providerDeviceId) {
    return new ProviderDeviceStatus(providerDeviceId, true, Instant.now(clock), true);
  }

  @VisibleForTesting
  boolean isDeployed(String enforcementReference) {
    return deployed.containsKey(enforcementReference);
  }
}
