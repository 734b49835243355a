package com.relationalizer.store;

import org.junit.jupiter.api.Test;

import java.time.Instant;

import static org.assertj.core.api.Assertions.*;

/**
 * Unit tests for Timestamps.
 */
class TimestampsTest {

    @Test
    void testIsoInstant() {
        assertThat(Timestamps.parse("2024-03-01T10:15:30Z")).isEqualTo(Instant.parse("2024-03-01T10:15:30Z"));
    }

    @Test
    void testOffsetDateTime() {
        assertThat(Timestamps.parse("2024-03-01T10:15:30+02:00")).isEqualTo(Instant.parse("2024-03-01T08:15:30Z"));
    }

    @Test
    void testLocalDateTimeIsUtc() {
        assertThat(Timestamps.parse("2024-03-01 10:15:30")).isEqualTo(Instant.parse("2024-03-01T10:15:30Z"));
        assertThat(Timestamps.parse(" 2024-03-01T10:15:30.250 ")).isEqualTo(Instant.parse("2024-03-01T10:15:30.250Z"));
    }

    @Test
    void testPlainDateIsStartOfDay() {
        assertThat(Timestamps.parse("2024-03-01")).isEqualTo(Instant.parse("2024-03-01T00:00:00Z"));
    }

    @Test
    void testMissingOrUnreadableIsEpoch() {
        assertThat(Timestamps.parse(null)).isEqualTo(Instant.EPOCH);
        assertThat(Timestamps.parse("  ")).isEqualTo(Instant.EPOCH);
        assertThat(Timestamps.parse("last tuesday")).isEqualTo(Instant.EPOCH);
    }
}
