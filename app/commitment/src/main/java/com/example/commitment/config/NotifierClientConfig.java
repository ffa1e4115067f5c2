package com.example.commitment.config;

import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.web.client.RestClient;

@Configuration
@ConditionalOnProperty(name = "commitment.notifier.type", havingValue = "http")
public class NotifierClientConfig {

  @Bean
  RestClient notifierRestClient(RestClient.Builder builder, NotifierClientProperties properties) {
    // notification サービス呼び出し専用 RestClient。
    return builder
        .baseUrl(properties.baseUrl())
        .requestFactory(
            RequestFactories.withTimeouts(properties.connectTimeout(), properties.readTimeout()))
        .build();
  }
}
