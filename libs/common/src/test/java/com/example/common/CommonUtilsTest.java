package com.example.common;

import static org.assertj.core.api.Assertions.assertThat;

import java.sql.Timestamp;
import java.time.Instant;
import org.junit.jupiter.api.Test;

class CommonUtilsTest {

  @Test
  void shortIdIsEightHexCharacters() {
    assertThat(TraceIds.newShortId()).matches("[0-9a-f]{8}");
  }

  @Test
  void traceIdIsUuid() {
    assertThat(TraceIds.newTraceId()).hasSize(36).contains("-");
  }

  @Test
  void timestampConversionKeepsInstantAndPassesNull() {
    final Instant instant = Instant.parse("2026-01-10T03:00:00.123Z");
    assertThat(JdbcTimestampUtils.toTimestamp(instant)).isEqualTo(Timestamp.from(instant));
    assertThat(JdbcTimestampUtils.toTimestamp(null)).isNull();
    assertThat(JdbcTimestampUtils.toInstant(Timestamp.from(instant))).isEqualTo(instant);
    assertThat(JdbcTimestampUtils.toInstant(null)).isNull();
  }
}
