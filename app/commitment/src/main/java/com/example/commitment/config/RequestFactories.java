package com.example.commitment.config;

import java.time.Duration;
import org.springframework.http.client.SimpleClientHttpRequestFactory;

final class RequestFactories {

  private RequestFactories() {}

  // 呼び出しごとに接続/読み取りの上限を掛け、停止した下流でスイープ全体が止まらないようにする
  static SimpleClientHttpRequestFactory withTimeouts(
      Duration connectTimeout, Duration readTimeout) {
    final SimpleClientHttpRequestFactory factory = new SimpleClientHttpRequestFactory();
    factory.setConnectTimeout(connectTimeout);
    factory.setReadTimeout(readTimeout);
    return factory;
  }
}
