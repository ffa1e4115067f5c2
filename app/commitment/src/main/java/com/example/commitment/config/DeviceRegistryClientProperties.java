package com.example.commitment.config;

import java.time.Duration;
import org.springframework.boot.context.properties.ConfigurationProperties;

@ConfigurationProperties(prefix = "commitment.device-registry")
public record DeviceRegistryClientProperties(
    String baseUrl, String getDevicePath, Duration connectTimeout, Duration readTimeout) {

  public DeviceRegistryClientProperties {
    baseUrl = baseUrl == null ? "http://device-registry:80" : baseUrl;
    getDevicePath =
        getDevicePath == null || getDevicePath.isBlank()
            ? "/v1/users/{userId}/devices/{deviceId}"
            : getDevicePath;
    connectTimeout = connectTimeout == null ? Duration.ofSeconds(2) : connectTimeout;
    readTimeout = readTimeout == null ? Duration.ofSeconds(5) : readTimeout;
  }
}
