/*
 * どこで: Commitment API
 * 何を: エラー応答のコードを定義する
 * なぜ: 同じ HTTP ステータスでも原因を区別できるようにするため
 */
package com.example.commitment.api;

public enum ApiErrorCode {
  BAD_REQUEST,
  CONFIRMATION_REQUIRED,
  SUBSCRIPTION_REQUIRED,
  POLICY_VIOLATION,
  DEVICE_NOT_FOUND,
  DEVICE_NOT_ENROLLED,
  ACTIVE_COMMITMENT_EXISTS,
  COMMITMENT_NOT_FOUND,
  COMMITMENT_STATE_CONFLICT,
  PROVIDER_UNAVAILABLE,
  PROVIDER_ERROR,
  UPSTREAM_TIMEOUT,
  UPSTREAM_ERROR,
  STORE_UNAVAILABLE
}
