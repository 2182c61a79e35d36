package com.healthion.common;

import static org.assertj.core.api.Assertions.assertThat;

import java.sql.Timestamp;
import java.time.Instant;
import org.junit.jupiter.api.Test;

class JdbcTimestampUtilsTest {

  @Test
  void convertsBothWaysWithoutLosingPrecision() {
    final Instant instant = Instant.parse("2026-01-02T03:04:05.123456Z");

    final Timestamp timestamp = JdbcTimestampUtils.toTimestamp(instant);

    assertThat(JdbcTimestampUtils.toInstant(timestamp)).isEqualTo(instant);
  }

  @Test
  void nullStaysNull() {
    assertThat(JdbcTimestampUtils.toTimestamp(null)).isNull();
    assertThat(JdbcTimestampUtils.toInstant(null)).isNull();
  }
}
