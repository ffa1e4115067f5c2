/*
 * どこで: Commitment サービス層 (下流サービス連携)
 * 何を: デバイス台帳から利用者所有の端末を取得する
 * なぜ: 作成時に所有確認と MDM 登録有無を判定するため
 */
package com.example.commitment.service.client;

import com.example.commitment.config.DeviceRegistryClientProperties;
import com.example.commitment.model.DeviceRecord;
import com.example.commitment.service.client.dto.DeviceResponse;
import edu.umd.cs.findbugs.annotations.SuppressFBWarnings;
import java.util.Optional;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;
import org.springframework.web.client.ResourceAccessException;
import org.springframework.web.client.RestClient;
import org.springframework.web.client.RestClientResponseException;

@Service
public class DeviceRegistryClient {

  private static final Logger logger = LoggerFactory.getLogger(DeviceRegistryClient.class);
  private static final String OPERATION = "device-registry getDevice";

  private final RestClient deviceRegistryRestClient;
  private final DeviceRegistryClientProperties properties;

  @SuppressFBWarnings(
      value = "EI_EXPOSE_REP2",
      justification = "RestClient は Spring 管理の共有コンポーネントで防御的コピーが不可能なため")
  public DeviceRegistryClient(
      RestClient deviceRegistryRestClient, DeviceRegistryClientProperties properties) {
    this.deviceRegistryRestClient = deviceRegistryRestClient;
    this.properties = properties;
  }

  /** Returns the device when it exists and belongs to the user. */
  public Optional<DeviceRecord> getDevice(String deviceId, String userId) {
    if (deviceId == null || deviceId.isBlank() || userId == null || userId.isBlank()) {
      throw new IllegalArgumentException("deviceId and userId are required");
    }
    final DeviceResponse response;
    try {
      response =
          deviceRegistryRestClient
              .get()
              .uri(properties.getDevicePath(), userId, deviceId)
              .retrieve()
              .body(DeviceResponse.class);
    } catch (RestClientResponseException ex) {
      if (ex.getStatusCode().value() == 404) {
        return Optional.empty();
      }
      throw CollaboratorErrors.fromResponse(logger, OPERATION, ex);
    } catch (ResourceAccessException ex) {
      throw CollaboratorErrors.fromResource(logger, OPERATION, ex);
    } catch (RuntimeException ex) {
      logger.warn("{} response parse failed", OPERATION, ex);
      throw CollaboratorErrors.invalidResponse(OPERATION, ex);
    }
    if (response == null || response.deviceId() == null || response.deviceId().isBlank()) {
      throw CollaboratorErrors.invalidResponse(OPERATION, null);
    }
    // 他人の端末は存在しないものとして扱う
    if (!userId.equals(response.userId())) {
      return Optional.empty();
    }
    return Optional.of(
        new DeviceRecord(
            response.deviceId(),
            response.userId(),
            response.deviceName(),
            response.providerDeviceId()));
  }
}
