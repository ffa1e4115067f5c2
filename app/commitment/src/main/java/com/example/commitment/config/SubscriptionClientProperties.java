package com.example.commitment.config;

import java.time.Duration;
import org.springframework.boot.context.properties.ConfigurationProperties;

@ConfigurationProperties(prefix = "commitment.subscription")
public record SubscriptionClientProperties(
    String baseUrl, String activeSubscriptionPath, Duration connectTimeout, Duration readTimeout) {

  public SubscriptionClientProperties {
    baseUrl = baseUrl == null ? "http://billing:80" : baseUrl;
    activeSubscriptionPath =
        activeSubscriptionPath == null || activeSubscriptionPath.isBlank()
            ? "/v1/users/{userId}/subscriptions/active"
            : activeSubscriptionPath;
    connectTimeout = connectTimeout == null ? Duration.ofSeconds(2) : connectTimeout;
    readTimeout = readTimeout == null ? Duration.ofSeconds(5) : readTimeout;
  }
}
