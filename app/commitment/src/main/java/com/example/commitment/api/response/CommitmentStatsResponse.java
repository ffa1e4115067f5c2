package com.example.commitment.api.response;

import com.fasterxml.jackson.databind.PropertyNamingStrategies;
import com.fasterxml.jackson.databind.annotation.JsonNaming;
import java.util.List;

@JsonNaming(PropertyNamingStrategies.SnakeCaseStrategy.class)
public record CommitmentStatsResponse(List<StatusStat> byStatus, String lastSweepAt) {

  public CommitmentStatsResponse {
    byStatus = byStatus == null ? List.of() : List.copyOf(byStatus);
  }

  @JsonNaming(PropertyNamingStrategies.SnakeCaseStrategy.class)
  public record StatusStat(String status, long count, double averageDays) {}
}
