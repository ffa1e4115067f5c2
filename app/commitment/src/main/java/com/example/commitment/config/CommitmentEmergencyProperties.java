package com.example.commitment.config;

import org.springframework.boot.context.properties.ConfigurationProperties;

@ConfigurationProperties(prefix = "commitment.emergency")
public record CommitmentEmergencyProperties(String supportEmail) {

  public CommitmentEmergencyProperties {
    supportEmail =
        supportEmail == null || supportEmail.isBlank() ? "support@example.com" : supportEmail;
  }
}
