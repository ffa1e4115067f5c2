/*
 * どこで: Commitment サービス層 (下流サービス連携)
 * 何を: 課金/デバイス台帳呼び出しの失敗を表現する
 * なぜ: API 層で HTTP ステータスへ一貫変換するため
 */
package com.example.commitment.service.client;

public class CollaboratorIntegrationException extends RuntimeException {

  public enum Reason {
    TIMEOUT,
    INVALID_RESPONSE,
    BAD_GATEWAY
  }

  private final Reason reason;

  public CollaboratorIntegrationException(Reason reason, String message) {
    super(message);
    this.reason = reason;
  }

  public CollaboratorIntegrationException(Reason reason, String message, Throwable cause) {
    super(message, cause);
    this.reason = reason;
  }

  public Reason reason() {
    return reason;
  }
}
