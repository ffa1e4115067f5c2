/*
 * どこで: Commitment サービス層
 * 何を: 外部呼び出し 1 回分の成功値または失敗種別を保持する
 * なぜ: 呼び出し箇所で try/catch を散らさず、結果を値として分岐させるため
 */
package com.example.commitment.service;

public record CallResult<T>(T value, ExternalErrorKind errorKind, String errorMessage) {

  public static <T> CallResult<T> success(T value) {
    return new CallResult<>(value, null, null);
  }

  public static <T> CallResult<T> failure(ExternalErrorKind errorKind, String errorMessage) {
    if (errorKind == null) {
      throw new IllegalArgumentException("errorKind is required for failure");
    }
    return new CallResult<>(null, errorKind, errorMessage);
  }

  public boolean isSuccess() {
    return errorKind == null;
  }
}
