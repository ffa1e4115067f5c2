/*
 * どこで: 共通ユーティリティ
 * 何を: JDBC の Timestamp と Instant を相互に変換する
 * なぜ: PostgreSQL JDBC の Instant 型推論に頼らず、NULL 許容列も同じ書き方で扱うため
 */
package com.example.common;

import java.sql.ResultSet;
import java.sql.SQLException;
import java.sql.Timestamp;
import java.time.Instant;

public final class JdbcTimestampUtils {
  private JdbcTimestampUtils() {}

  // Instant は UTC のまま Timestamp.from で渡し、DB 側のタイムゾーン設定に依存しない
  public static Timestamp toTimestamp(Instant instant) {
    return instant == null ? null : Timestamp.from(instant);
  }

  public static Instant toInstant(Timestamp timestamp) {
    return timestamp == null ? null : timestamp.toInstant();
  }

  public static Instant getInstant(ResultSet rs, String column) throws SQLException {
    return toInstant(rs.getTimestamp(column));
  }
}
