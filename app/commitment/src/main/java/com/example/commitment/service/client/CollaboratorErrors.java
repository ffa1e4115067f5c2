package com.example.commitment.service.client;

import java.net.SocketTimeoutException;
import org.slf4j.Logger;
import org.springframework.web.client.ResourceAccessException;
import org.springframework.web.client.RestClientResponseException;

final class CollaboratorErrors {

  private CollaboratorErrors() {}

  static CollaboratorIntegrationException fromResponse(
      Logger logger, String operation, RestClientResponseException ex) {
    logger.warn(
        "{} failed with http status={} statusText={}",
        operation,
        ex.getStatusCode().value(),
        ex.getStatusText());
    if (ex.getStatusCode().is5xxServerError()) {
      return new CollaboratorIntegrationException(
          CollaboratorIntegrationException.Reason.BAD_GATEWAY, operation + " server error", ex);
    }
    return new CollaboratorIntegrationException(
        CollaboratorIntegrationException.Reason.BAD_GATEWAY, operation + " request failed", ex);
  }

  static CollaboratorIntegrationException fromResource(
      Logger logger, String operation, ResourceAccessException ex) {
    if (isTimeout(ex)) {
      logger.warn("{} timed out", operation);
      return new CollaboratorIntegrationException(
          CollaboratorIntegrationException.Reason.TIMEOUT, operation + " timeout", ex);
    }
    logger.warn("{} connection failed", operation, ex);
    return new CollaboratorIntegrationException(
        CollaboratorIntegrationException.Reason.BAD_GATEWAY, operation + " connection failed", ex);
  }

  static CollaboratorIntegrationException invalidResponse(String operation, Throwable cause) {
    return new CollaboratorIntegrationException(
        CollaboratorIntegrationException.Reason.INVALID_RESPONSE,
        operation + " response is invalid",
        cause);
  }

  private static boolean isTimeout(ResourceAccessException ex) {
    Throwable current = ex;
    while (current != null) {
      if (current instanceof SocketTimeoutException) {
        return true;
      }
      current = current.getCause();
    }
    return false;
  }
}
