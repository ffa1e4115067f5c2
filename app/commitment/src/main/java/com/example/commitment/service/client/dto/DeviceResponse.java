package com.example.commitment.service.client.dto;

import com.fasterxml.jackson.databind.PropertyNamingStrategies;
import com.fasterxml.jackson.databind.annotation.JsonNaming;

@JsonNaming(PropertyNamingStrategies.SnakeCaseStrategy.class)
public record DeviceResponse(
    String deviceId, String userId, String deviceName, String providerDeviceId) {}
