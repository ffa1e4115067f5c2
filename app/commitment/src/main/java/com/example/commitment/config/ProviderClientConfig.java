/*
 * どこで: Commitment 設定
 * 何を: MDM プロバイダ呼び出し専用 RestClient を提供する
 * なぜ: 認証ヘッダとタイムアウトをプロバイダ単位で固定するため
 */
package com.example.commitment.config;

import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.http.HttpHeaders;
import org.springframework.http.MediaType;
import org.springframework.web.client.RestClient;

@Configuration
@ConditionalOnProperty(
    name = "commitment.provider.type",
    havingValue = "http",
    matchIfMissing = true)
public class ProviderClientConfig {

  @Bean
  RestClient providerRestClient(RestClient.Builder builder, ProviderClientProperties properties) {
    return builder
        .baseUrl(properties.baseUrl())
        .requestFactory(
            RequestFactories.withTimeouts(properties.connectTimeout(), properties.readTimeout()))
        .defaultHeader(HttpHeaders.AUTHORIZATION, "Bearer " + properties.apiToken())
        .defaultHeader(HttpHeaders.CONTENT_TYPE, MediaType.APPLICATION_JSON_VALUE)
        .build();
  }
}
