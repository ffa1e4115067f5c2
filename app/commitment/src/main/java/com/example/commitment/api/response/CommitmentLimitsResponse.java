package com.example.commitment.api.response;

import com.fasterxml.jackson.databind.PropertyNamingStrategies;
import com.fasterxml.jackson.databind.annotation.JsonNaming;

@JsonNaming(PropertyNamingStrategies.SnakeCaseStrategy.class)
public record CommitmentLimitsResponse(
    int maxDays, String tier, String tierLabel, boolean hasSubscription) {}
