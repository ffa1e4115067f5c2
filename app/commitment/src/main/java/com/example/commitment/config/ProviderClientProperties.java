/*
 * どこで: Commitment アプリの設定バインド
 * 何を: MDM プロバイダ API の接続先/認証/タイムアウト設定を保持する
 * なぜ: 外部呼び出しを呼び出し単位のタイムアウトで必ず打ち切るため
 */
package com.example.commitment.config;

import java.time.Duration;
import org.springframework.boot.context.properties.ConfigurationProperties;

@ConfigurationProperties(prefix = "commitment.provider")
public record ProviderClientProperties(
    String type,
    String baseUrl,
    String apiToken,
    String organizationId,
    Duration connectTimeout,
    Duration readTimeout) {

  public ProviderClientProperties {
    type = type == null || type.isBlank() ? "http" : type;
    baseUrl = baseUrl == null ? "http://mdm-provider:80/v1" : baseUrl;
    apiToken = apiToken == null ? "" : apiToken;
    organizationId = organizationId == null ? "" : organizationId;
    connectTimeout = connectTimeout == null ? Duration.ofSeconds(2) : connectTimeout;
    readTimeout = readTimeout == null ? Duration.ofSeconds(10) : readTimeout;
  }
}
