/*
 * どこで: Commitment アプリの設定バインド
 * 何を: 通知送信先 (notification サービス) の設定を保持する
 * なぜ: ローカル送信と HTTP 送信を設定で切り替えるため
 */
package com.example.commitment.config;

import java.time.Duration;
import org.springframework.boot.context.properties.ConfigurationProperties;

@ConfigurationProperties(prefix = "commitment.notifier")
public record NotifierClientProperties(
    String type, String baseUrl, String path, Duration connectTimeout, Duration readTimeout) {

  public NotifierClientProperties {
    type = type == null || type.isBlank() ? "local" : type;
    baseUrl = baseUrl == null ? "http://notification:80" : baseUrl;
    path = path == null || path.isBlank() ? "/v1/notifications" : path;
    connectTimeout = connectTimeout == null ? Duration.ofSeconds(2) : connectTimeout;
    readTimeout = readTimeout == null ? Duration.ofSeconds(5) : readTimeout;
  }
}
