/*
 * どこで: Commitment サービス層 (プロバイダ連携)
 * 何を: MDM プロバイダ呼び出しの失敗を種類付きで表現する
 * なぜ: 呼び出し元が失敗ポリシー表で再試行/再登録/ロールバックを判断できるようにするため
 */
package com.example.commitment.service.provider;

import com.example.commitment.service.ExternalCallException;
import com.example.commitment.service.ExternalErrorKind;

public class ProviderIntegrationException extends ExternalCallException {

  public ProviderIntegrationException(ExternalErrorKind kind, String message) {
    super(kind, message);
  }

  public ProviderIntegrationException(ExternalErrorKind kind, String message, Throwable cause) {
    super(kind, message, cause);
  }
}
