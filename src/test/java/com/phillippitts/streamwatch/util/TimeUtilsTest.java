package com.phillippitts.streamwatch.util;

import org.junit.jupiter.api.Test;

import java.time.Duration;

import static org.assertj.core.api.Assertions.assertThat;

class TimeUtilsTest {

    @Test
    void shouldCalculateElapsedMillisFromPastTimestamp() {
        long startNanos = System.nanoTime() - (1_000L * TimeUtils.NANOS_PER_MILLI);

        long elapsedMs = TimeUtils.elapsedMillis(startNanos);

        assertThat(elapsedMs).isGreaterThanOrEqualTo(1000L);
        assertThat(elapsedMs).isLessThan(1500L);
    }

    @Test
    void shouldFormatDurationAsHoursMinutesSeconds() {
        assertThat(TimeUtils.formatDuration(Duration.ZERO)).isEqualTo("0:00:00");
        assertThat(TimeUtils.formatDuration(Duration.ofSeconds(59))).isEqualTo("0:00:59");
        assertThat(TimeUtils.formatDuration(Duration.ofSeconds(3725))).isEqualTo("1:02:05");
        assertThat(TimeUtils.formatDuration(Duration.ofHours(26).plusMinutes(3))).isEqualTo("26:03:00");
    }

    @Test
    void shouldDropFractionalSeconds() {
        assertThat(TimeUtils.formatDuration(Duration.ofMillis(61_999))).isEqualTo("0:01:01");
    }

    @Test
    void shouldFormatNullAndNegativeAsZero() {
        assertThat(TimeUtils.formatDuration(null)).isEqualTo("0:00:00");
        assertThat(TimeUtils.formatDuration(Duration.ofSeconds(-5))).isEqualTo("0:00:00");
    }
}
