package com.example.commitment.api;

public class CommitmentStateConflictException extends RuntimeException {

  public CommitmentStateConflictException(String message) {
    super(message);
  }
}
