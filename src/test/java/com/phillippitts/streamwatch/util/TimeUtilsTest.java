package com.phillippitts.streamwatch.util;

import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.time.Instant;

import static org.assertj.core.api.Assertions.assertThat;

class TimeUtilsTest {

    private static final Instant T0 = Instant.parse("2026-01-01T00:00:00Z");

    @Test
    void shouldConvertNanosToMillis() {
        assertThat(TimeUtils.nanosToMillis(1_000_000L)).isEqualTo(1L);
        // 2.999 milliseconds truncates to 2 milliseconds
        assertThat(TimeUtils.nanosToMillis(2_999_999L)).isEqualTo(2L);
        assertThat(TimeUtils.nanosToMillis(0L)).isZero();
    }

    @Test
    void shouldMeasureElapsedBetweenInstants() {
        assertThat(TimeUtils.elapsed(T0, T0.plusSeconds(35))).isEqualTo(Duration.ofSeconds(35));
        assertThat(TimeUtils.elapsed(T0, T0)).isEqualTo(Duration.ZERO);
    }

    @Test
    void shouldNeverReturnNegativeElapsed() {
        assertThat(TimeUtils.elapsed(T0.plusSeconds(5), T0)).isEqualTo(Duration.ZERO);
    }

    @Test
    void shouldTreatMissingInstantsAsZero() {
        assertThat(TimeUtils.elapsed(null, T0)).isEqualTo(Duration.ZERO);
        assertThat(TimeUtils.elapsed(T0, null)).isEqualTo(Duration.ZERO);
    }
}
