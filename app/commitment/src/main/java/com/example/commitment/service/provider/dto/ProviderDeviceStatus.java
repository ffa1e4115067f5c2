package com.example.commitment.service.provider.dto;

import java.time.Instant;

public record ProviderDeviceStatus(
    String providerDeviceId, boolean online, Instant lastSeenAt, boolean compliant) {}
