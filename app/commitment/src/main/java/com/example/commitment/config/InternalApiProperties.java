package com.example.commitment.config;

import org.springframework.boot.context.properties.ConfigurationProperties;

@ConfigurationProperties(prefix = "commitment.internal-api")
public record InternalApiProperties(
    String headerName, String token, String userIdHeaderName, String userRolesHeaderName) {

  public InternalApiProperties {
    headerName = headerName == null || headerName.isBlank() ? "X-Internal-Token" : headerName;
    token = token == null ? "" : token;
    userIdHeaderName =
        userIdHeaderName == null || userIdHeaderName.isBlank() ? "X-User-Id" : userIdHeaderName;
    userRolesHeaderName =
        userRolesHeaderName == null || userRolesHeaderName.isBlank()
            ? "X-User-Roles"
            : userRolesHeaderName;
  }
}
