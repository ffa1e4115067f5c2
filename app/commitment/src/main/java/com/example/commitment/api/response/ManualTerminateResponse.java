package com.example.commitment.api.response;

import com.fasterxml.jackson.databind.PropertyNamingStrategies;
import com.fasterxml.jackson.databind.annotation.JsonNaming;

@JsonNaming(PropertyNamingStrategies.SnakeCaseStrategy.class)
public record ManualTerminateResponse(
    String commitmentId, String status, String providerCleanup) {

  public static final String CLEANUP_COMPLETED = "COMPLETED";
  public static final String CLEANUP_FAILED = "FAILED";
  public static final String CLEANUP_SKIPPED = "SKIPPED";
}
