package com.example.commitment.service;

public class ExternalCallException extends RuntimeException {

  private final ExternalErrorKind kind;

  public ExternalCallException(ExternalErrorKind kind, String message) {
    super(message);
    this.kind = kind;
  }

  public ExternalCallException(ExternalErrorKind kind, String message, Throwable cause) {
    super(message, cause);
    this.kind = kind;
  }

  public ExternalErrorKind kind() {
    return kind;
  }
}
