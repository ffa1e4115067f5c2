/*
 * どこで: Commitment API
 * 何を: 入力/ポリシー違反をエラーコード付きで表す例外
 * なぜ: 状態を変更する前の検証失敗を呼び出し元へ理由付きで返すため
 */
package com.example.commitment.api;

import java.util.Map;

public class CommitmentValidationException extends RuntimeException {

  private final ApiErrorCode code;
  private final transient Map<String, Object> details;

  public CommitmentValidationException(ApiErrorCode code, String message) {
    this(code, message, Map.of());
  }

  public CommitmentValidationException(
      ApiErrorCode code, String message, Map<String, Object> details) {
    super(message);
    this.code = code;
    this.details = details == null ? Map.of() : Map.copyOf(details);
  }

  public ApiErrorCode code() {
    return code;
  }

  public Map<String, Object> details() {
    return details;
  }
}
