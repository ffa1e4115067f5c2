package com.example.commitment.service.provider.dto;

import java.time.Instant;
import java.util.List;

public record MdmDeviceResponse(String id, Instant lastSeenAt, List<InstalledProfile> profiles) {

  public MdmDeviceResponse {
    profiles = profiles == null ? List.of() : List.copyOf(profiles);
  }

  public record InstalledProfile(String id, String status) {}
}
