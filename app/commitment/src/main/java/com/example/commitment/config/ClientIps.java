package com.example.commitment.config;

import jakarta.servlet.http.HttpServletRequest;

public final class ClientIps {

  private ClientIps() {}

  /** Returns the first X-Forwarded-For hop, or the socket address when the header is absent. */
  public static String resolve(HttpServletRequest request) {
    final String xForwardedFor = request.getHeader("X-Forwarded-For");
    if (xForwardedFor == null || xForwardedFor.isBlank()) {
      return request.getRemoteAddr();
    }
    final int commaIndex = xForwardedFor.indexOf(',');
    if (commaIndex < 0) {
      return xForwardedFor.trim();
    }
    return xForwardedFor.substring(0, commaIndex).trim();
  }
}
