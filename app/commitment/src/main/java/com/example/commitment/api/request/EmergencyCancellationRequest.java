package com.example.commitment.api.request;

import com.fasterxml.jackson.databind.PropertyNamingStrategies;
import com.fasterxml.jackson.databind.annotation.JsonNaming;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.Size;

@JsonNaming(PropertyNamingStrategies.SnakeCaseStrategy.class)
public record EmergencyCancellationRequest(
    @NotBlank(message = "reason is required")
        @Size(min = 10, max = 2000, message = "reason must be between 10 and 2000 characters")
        String reason,
    Boolean confirmEmergency) {}
