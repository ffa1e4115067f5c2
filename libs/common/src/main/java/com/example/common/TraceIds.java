package com.example.common;

import java.util.UUID;

public final class TraceIds {
  private static final int SHORT_ID_LENGTH = 8;

  private TraceIds() {}

  public static String newTraceId() {
    return UUID.randomUUID().toString();
  }

  // ログ相関用の短い ID。衝突は許容し、一意性が必要な箇所では newTraceId を使う
  public static String newShortId() {
    return newTraceId().replace("-", "").substring(0, SHORT_ID_LENGTH);
  }
}
