package com.example.commitment.service.notifier;

import com.fasterxml.jackson.databind.PropertyNamingStrategies;
import com.fasterxml.jackson.databind.annotation.JsonNaming;
import java.util.Map;

@JsonNaming(PropertyNamingStrategies.SnakeCaseStrategy.class)
public record NotificationRequest(
    String notificationId,
    String userId,
    String type,
    String subject,
    Map<String, Object> payload) {

  public NotificationRequest {
    payload = payload == null ? Map.of() : Map.copyOf(payload);
  }
}
