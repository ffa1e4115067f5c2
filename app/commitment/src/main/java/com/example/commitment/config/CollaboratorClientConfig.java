/*
 * どこで: Commitment 設定
 * 何を: 課金 (subscription) とデバイス台帳の RestClient を提供する
 * なぜ: 下流サービスごとに baseUrl とタイムアウトの責務を分離するため
 */
package com.example.commitment.config;

import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.web.client.RestClient;

@Configuration
public class CollaboratorClientConfig {

  @Bean
  RestClient subscriptionRestClient(
      RestClient.Builder builder, SubscriptionClientProperties properties) {
    return builder
        .baseUrl(properties.baseUrl())
        .requestFactory(
            RequestFactories.withTimeouts(properties.connectTimeout(), properties.readTimeout()))
        .build();
  }

  @Bean
  RestClient deviceRegistryRestClient(
      RestClient.Builder builder, DeviceRegistryClientProperties properties) {
    return builder
        .baseUrl(properties.baseUrl())
        .requestFactory(
            RequestFactories.withTimeouts(properties.connectTimeout(), properties.readTimeout()))
        .build();
  }
}
