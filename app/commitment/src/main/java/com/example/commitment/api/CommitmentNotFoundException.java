package com.example.commitment.api;

public class CommitmentNotFoundException extends RuntimeException {

  public CommitmentNotFoundException(String message) {
    super(message);
  }
}
