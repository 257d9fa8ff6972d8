package com.phillippitts.cabinassist.util;

import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.time.Instant;

import static org.assertj.core.api.Assertions.assertThat;

class TimeUtilsTest {

    private static final Instant START = Instant.parse("2025-01-01T08:00:00Z");

    @Test
    void measuresForwardElapsedTime() {
        assertThat(TimeUtils.elapsedBetween(START, START.plusSeconds(9))).isEqualTo(Duration.ofSeconds(9));
    }

    @Test
    void neverNegative() {
        assertThat(TimeUtils.elapsedBetween(START, START.minusMillis(1))).isEqualTo(Duration.ZERO);
    }

    @Test
    void nullInstantsYieldZero() {
        assertThat(TimeUtils.elapsedBetween(null, START)).isEqualTo(Duration.ZERO);
        assertThat(TimeUtils.elapsedBetween(START, null)).isEqualTo(Duration.ZERO);
    }
}
