package com.example.commitment.service.provider.dto;

import java.util.List;
import java.util.Map;

public record MdmProfileRequest(
    String organizationId,
    String name,
    String description,
    List<Payload> payloads,
    Scope scope) {

  public MdmProfileRequest {
    payloads = payloads == null ? List.of() : List.copyOf(payloads);
  }

  public record Payload(String type, Map<String, Object> settings) {

    public Payload {
      settings = settings == null ? Map.of() : Map.copyOf(settings);
    }
  }

  public record Scope(List<String> devices) {

    public Scope {
      devices = devices == null ? List.of() : List.copyOf(devices);
    }
  }
}
