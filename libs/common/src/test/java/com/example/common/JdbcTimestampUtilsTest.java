package com.example.common;

import static org.assertj.core.api.Assertions.assertThat;

import java.sql.Timestamp;
import java.time.Instant;
import org.junit.jupiter.api.Test;

class JdbcTimestampUtilsTest {

  private static final Instant INSTANT = Instant.parse("2026-03-31T23:59:59.123Z");

  @Test
  void convertsBothWaysWithoutLosingPrecision() {
    final Timestamp timestamp = JdbcTimestampUtils.toTimestamp(INSTANT);

    assertThat(JdbcTimestampUtils.toInstant(timestamp)).isEqualTo(INSTANT);
  }

  @Test
  void nullStaysNull() {
    assertThat(JdbcTimestampUtils.toTimestamp(null)).isNull();
    assertThat(JdbcTimestampUtils.toInstant(null)).isNull();
  }
}
