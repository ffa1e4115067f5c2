package com.example.commitment.service.notifier;

import com.example.commitment.service.ExternalCallException;
import com.example.commitment.service.ExternalErrorKind;

public class NotificationDeliveryException extends ExternalCallException {

  public NotificationDeliveryException(ExternalErrorKind kind, String message) {
    super(kind, message);
  }

  public NotificationDeliveryException(ExternalErrorKind kind, String message, Throwable cause) {
    super(kind, message, cause);
  }
}
