package com.notifyhub.common;

import static org.assertj.core.api.Assertions.assertThat;

import java.sql.Timestamp;
import java.time.Instant;
import org.junit.jupiter.api.Test;

class JdbcTimestampUtilsTest {

  @Test
  void convertsBothDirectionsWithoutShiftingTime() {
    Instant instant = Instant.parse("2026-01-17T00:00:00Z");

    Timestamp timestamp = JdbcTimestampUtils.toTimestamp(instant);

    assertThat(JdbcTimestampUtils.toInstant(timestamp)).isEqualTo(instant);
  }

  @Test
  void nullStaysNull() {
    assertThat(JdbcTimestampUtils.toTimestamp(null)).isNull();
    assertThat(JdbcTimestampUtils.toInstant(null)).isNull();
  }
}
