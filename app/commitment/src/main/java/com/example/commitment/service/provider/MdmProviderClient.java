/*
 * どこで: Commitment サービス層 (プロバイダ連携)
 * 何を: MDM プロバイダ REST API を呼び出し、失敗を ExternalErrorKind へ正規化する
 * なぜ: プロバイダ固有の HTTP ステータスを呼び出し元へ漏らさないため
 */
package com.example.commitment.service.provider;

import com.example.commitment.config.ProviderClientProperties;
import com.example.commitment.model.LockedSettings;
import com.example.commitment.service.ExternalErrorKind;
import com.example.commitment.service.provider.dto.DeviceInvitation;
import com.example.commitment.service.provider.dto.MdmDeploymentRequest;
import com.example.commitment.service.provider.dto.MdmDeploymentResponse;
import com.example.commitment.service.provider.dto.MdmDeviceResponse;
import com.example.commitment.service.provider.dto.MdmInvitationRequest;
import com.example.commitment.service.provider.dto.MdmInvitationResponse;
import com.example.commitment.service.provider.dto.MdmProfileRequest;
import com.example.commitment.service.provider.dto.MdmProfileResponse;
import com.example.commitment.service.provider.dto.ProviderDeviceStatus;
import com.example.commitment.service.provider.dto.RestrictionProfileDescriptor;
import edu.umd.cs.findbugs.annotations.SuppressFBWarnings;
import java.net.SocketTimeoutException;
import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.function.Supplier;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.stereotype.Service;
import org.springframework.web.client.ResourceAccessException;
import org.springframework.web.client.RestClient;
import org.springframework.web.client.RestClientResponseException;

@Service
@ConditionalOnProperty(
    name = "commitment.provider.type",
    havingValue = "http",
    matchIfMissing = true)
public class MdmProviderClient implements RestrictionProvider {

  private static final Logger logger = LoggerFactory.getLogger(MdmProviderClient.class);
  private static final Duration ONLINE_THRESHOLD = Duration.ofMinutes(15);
  private static final String RESTRICTIONS_PAYLOAD_TYPE = "com.apple.applicationaccess";

  private final RestClient providerRestClient;
  private final ProviderClientProperties properties;
  private final Clock clock;

  @SuppressFBWarnings(
      value = "EI_EXPOSE_REP2",
      justification = "RestClient と Clock は Spring 管理の共有コンポーネントで防御的コピーが不可能なため")
  public MdmProviderClient(
      RestClient providerRestClient, ProviderClientProperties properties, Clock clock) {
    this.providerRestClient = providerRestClient;
    this.properties = properties;
    this.clock = clock;
  }

  @Override
  public DeviceInvitation createDeviceInvitation(String deviceName, String ownerEmail) {
    requireText(deviceName, "deviceName");
    final MdmInvitationResponse response =
        execute(
            "createDeviceInvitation",
            () ->
                providerRestClient
                    .post()
                    .uri("/invitations")
                    .body(
                        new MdmInvitationRequest(
                            properties.organizationId(), deviceName, ownerEmail))
                    .retrieve()
                    .body(MdmInvitationResponse.class));
    if (response == null || isBlank(response.id()) || isBlank(response.enrollmentUrl())) {
      throw invalidResponse("createDeviceInvitation");
    }
    return new DeviceInvitation(
        response.id(), response.enrollmentUrl(), response.invitationCode());
  }

  @Override
  public String createRestrictionProfile(
      String providerDeviceId, RestrictionProfileDescriptor descriptor) {
    requireText(providerDeviceId, "providerDeviceId");
    final MdmProfileRequest request =
        new MdmProfileRequest(
            properties.organizationId(),
            descriptor.name(),
            descriptor.description(),
            List.of(
                new MdmProfileRequest.Payload(
                    RESTRICTIONS_PAYLOAD_TYPE, restrictionSettings(descriptor.lockedSettings()))),
            new MdmProfileRequest.Scope(List.of(providerDeviceId)));
    final MdmProfileResponse response =
        execute(
            "createRestrictionProfile",
            () ->
                providerRestClient
                    .post()
                    .uri("/profiles")
                    .body(request)
                    .retrieve()
                    .body(MdmProfileResponse.class));
    if (response == null || isBlank(response.id())) {
      throw invalidResponse("createRestrictionProfile");
    }
    logger.info(
        "provider profile created providerDeviceId={} profileId={}",
        providerDeviceId,
        response.id());
    return response.id();
  }

  @Override
  public String deployProfile(String providerDeviceId, String enforcementReference) {
    requireText(providerDeviceId, "providerDeviceId");
    requireText(enforcementReference, "enforcementReference");
    final MdmDeploymentResponse response =
        execute(
            "deployProfile",
            () ->
                providerRestClient
                    .post()
                    .uri("/devices/{deviceId}/profiles", providerDeviceId)
                    .body(new MdmDeploymentRequest(enforcementReference))
                    .retrieve()
                    .body(MdmDeploymentResponse.class));
    if (response == null || isBlank(response.id())) {
      throw invalidResponse("deployProfile");
    }
    return response.id();
  }

  @Override
  public void removeProfile(String providerDeviceId, String enforcementReference) {
    requireText(providerDeviceId, "providerDeviceId");
    requireText(enforcementReference, "enforcementReference");
    try {
      providerRestClient
          .delete()
          .uri(
              "/devices/{deviceId}/profiles/{profileId}", providerDeviceId, enforcementReference)
          .retrieve()
          .toBodilessEntity();
    } catch (RestClientResponseException ex) {
      if (ex.getStatusCode().value() == 404) {
        // 既に外れているプロファイルは削除済みとして扱う
        logger.info(
            "provider profile already absent providerDeviceId={} profileId={}",
            providerDeviceId,
            enforcementReference);
        return;
      }
      throw mapResponseException("removeProfile", ex);
    } catch (ResourceAccessException ex) {
      throw mapResourceException("removeProfile", ex);
    }
  }

  @Override
  public ProviderDeviceStatus getDeviceStatus(String providerDeviceId) {
    requireText(providerDeviceId, "providerDeviceId");
    final MdmDeviceResponse response =
        execute(
            "getDeviceStatus",
            () ->
                providerRestClient
                    .get()
                    .uri("/devices/{deviceId}", providerDeviceId)
                    .retrieve()
                    .body(MdmDeviceResponse.class));
    if (response == null || isBlank(response.id())) {
      throw invalidResponse("getDeviceStatus");
    }
    final Instant lastSeenAt = response.lastSeenAt();
    final boolean online =
        lastSeenAt != null && !lastSeenAt.isBefore(Instant.now(clock).minus(ONLINE_THRESHOLD));
    final boolean compliant =
        response.profiles().stream().allMatch(profile -> "installed".equals(profile.status()));
    return new ProviderDeviceStatus(response.id(), online, lastSeenAt, compliant);
  }

  private Map<String, Object> restrictionSettings(LockedSettings lockedSettings) {
    final LockedSettings locked =
        lockedSettings == null ? LockedSettings.allLocked() : lockedSettings;
    final Map<String, Object> settings = new LinkedHashMap<>();
    settings.put("allowUIConfigurationProfileInstallation", locked.profileRemoval());
    settings.put("allowEraseContentAndSettings", locked.factoryReset());
    settings.put("allowAppInstallation", locked.appInstallation());
    settings.put("allowAppRemoval", locked.appInstallation());
    settings.put("allowAccountModification", locked.systemSettings());
    settings.put("allowPasscodeModification", locked.systemSettings());
    return settings;
  }

  private <T> T execute(String operation, Supplier<T> call) {
    try {
      return call.get();
    } catch (RestClientResponseException ex) {
      throw mapResponseException(operation, ex);
    } catch (ResourceAccessException ex) {
      throw mapResourceException(operation, ex);
    } catch (ProviderIntegrationException ex) {
      throw ex;
    } catch (RuntimeException ex) {
      logger.warn("provider {} response parse failed", operation, ex);
      throw new ProviderIntegrationException(
          ExternalErrorKind.INVALID_RESPONSE, "provider response parse failed", ex);
    }
  }

  private ProviderIntegrationException mapResponseException(
      String operation, RestClientResponseException ex) {
    final int status = ex.getStatusCode().value();
    logger.warn(
        "provider {} failed with http status={} statusText={}",
        operation,
        status,
        ex.getStatusText());
    if (status == 404) {
      return new ProviderIntegrationException(
          ExternalErrorKind.DEVICE_NOT_ENROLLED, "device is not enrolled with provider", ex);
    }
    if (status == 429 || ex.getStatusCode().is5xxServerError()) {
      return new ProviderIntegrationException(
          ExternalErrorKind.UNAVAILABLE, "provider unavailable", ex);
    }
    return new ProviderIntegrationException(
        ExternalErrorKind.REJECTED, "provider rejected request", ex);
  }

  private ProviderIntegrationException mapResourceException(
      String operation, ResourceAccessException ex) {
    if (isTimeout(ex)) {
      logger.warn("provider {} timed out", operation);
      return new ProviderIntegrationException(
          ExternalErrorKind.TIMEOUT, "provider request timeout", ex);
    }
    logger.warn("provider {} connection failed", operation, ex);
    return new ProviderIntegrationException(
        ExternalErrorKind.UNAVAILABLE, "provider connection failed", ex);
  }

  private ProviderIntegrationException invalidResponse(String operation) {
    return new ProviderIntegrationException(
        ExternalErrorKind.INVALID_RESPONSE, "provider " + operation + " response is invalid");
  }

  private boolean isTimeout(ResourceAccessException ex) {
    Throwable current = ex;
    while (current != null) {
      if (current instanceof SocketTimeoutException) {
        return true;
      }
      current = current.getCause();
    }
    return false;
  }

  private void requireText(String value, String name) {
    if (isBlank(value)) {
      throw new IllegalArgumentException(name + " is required");
    }
  }

  private boolean isBlank(String value) {
    return value == null || value.isBlank();
  }
}
