/*
 * どこで: Commitment API
 * 何を: エラーレスポンスの共通フォーマットを定義する
 * なぜ: クライアントがエラー原因と補足情報を機械的に判別できるようにするため
 */
package com.example.commitment.api;

import com.fasterxml.jackson.databind.PropertyNamingStrategies;
import com.fasterxml.jackson.databind.annotation.JsonNaming;
import java.util.Map;

@JsonNaming(PropertyNamingStrategies.SnakeCaseStrategy.class)
public record ApiErrorResponse(ApiErrorCode code, String message, Map<String, Object> details) {

  public ApiErrorResponse {
    details = details == null ? Map.of() : Map.copyOf(details);
  }

  public ApiErrorResponse(ApiErrorCode code, String message) {
    this(code, message, Map.of());
  }
}
