package com.example.commitment.api.response;

import com.fasterxml.jackson.databind.PropertyNamingStrategies;
import com.fasterxml.jackson.databind.annotation.JsonNaming;
import java.util.List;

@JsonNaming(PropertyNamingStrategies.SnakeCaseStrategy.class)
public record CommitmentHistoryResponse(
    List<Item> commitments, int page, int limit, long total, long totalPages) {

  public CommitmentHistoryResponse {
    commitments = commitments == null ? List.of() : List.copyOf(commitments);
  }

  @JsonNaming(PropertyNamingStrategies.SnakeCaseStrategy.class)
  public record Item(
      String commitmentId,
      String deviceId,
      String deviceName,
      int durationDays,
      String commitmentStart,
      String commitmentEnd,
      String status,
      String createdAt) {}
}
