package com.example.commitment.service;

public enum FailureAction {
  ABORT_AND_ROLLBACK,
  LOG_AND_CONTINUE,
  RETRY_NEXT_SWEEP
}
