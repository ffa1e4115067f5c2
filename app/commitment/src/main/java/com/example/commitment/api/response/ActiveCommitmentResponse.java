package com.example.commitment.api.response;

import com.fasterxml.jackson.databind.PropertyNamingStrategies;
import com.fasterxml.jackson.databind.annotation.JsonNaming;

@JsonNaming(PropertyNamingStrategies.SnakeCaseStrategy.class)
public record ActiveCommitmentResponse(
    CommitmentResponse commitment, long secondsRemaining, DeviceStatusView deviceStatus) {

  // プロバイダから取得できなかった場合は null
  @JsonNaming(PropertyNamingStrategies.SnakeCaseStrategy.class)
  public record DeviceStatusView(boolean online, boolean compliant, String lastSeen) {}
}
