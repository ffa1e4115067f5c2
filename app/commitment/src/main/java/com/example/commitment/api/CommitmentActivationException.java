/*
 * どこで: Commitment API
 * 何を: プロバイダ側の制限適用に失敗したことを表す例外
 * なぜ: ロールバック済みであることと、再試行/再登録の要否をクライアントへ伝えるため
 */
package com.example.commitment.api;

import com.example.commitment.service.ExternalErrorKind;

public class CommitmentActivationException extends RuntimeException {

  private final ExternalErrorKind kind;

  public CommitmentActivationException(ExternalErrorKind kind, String message) {
    super(message);
    this.kind = kind;
  }

  public ExternalErrorKind kind() {
    return kind;
  }

  public boolean retryable() {
    return kind.isRetryable();
  }

  public boolean reenrollRequired() {
    return kind.requiresReenrollment();
  }
}
