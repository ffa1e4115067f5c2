package com.example.commitment.service;

// 外部呼び出しの発生箇所。FailurePolicy の表のキーになる
public enum CallSite {
  CREATE_PROFILE,
  DEPLOY_PROFILE,
  REMOVE_ON_ROLLBACK,
  REMOVE_ON_EXPIRY,
  REMOVE_ON_MANUAL_TERMINATE,
  DEVICE_STATUS,
  NOTIFY_COMPLETION,
  NOTIFY_WARNING
}
