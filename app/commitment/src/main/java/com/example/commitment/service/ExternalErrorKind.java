/*
 * どこで: Commitment サービス層
 * 何を: 外部呼び出し (プロバイダ/通知) 失敗の種類を列挙する
 * なぜ: 呼び出し箇所ごとの失敗ポリシーを例外型ではなく種類で判定するため
 */
package com.example.commitment.service;

public enum ExternalErrorKind {
  TIMEOUT,
  UNAVAILABLE,
  REJECTED,
  DEVICE_NOT_ENROLLED,
  INVALID_RESPONSE,
  UNEXPECTED;

  public boolean isRetryable() {
    return this == TIMEOUT || this == UNAVAILABLE;
  }

  public boolean requiresReenrollment() {
    return this == DEVICE_NOT_ENROLLED;
  }
}
