package com.phillippitts.telesession.util;

import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.time.Instant;

import static org.assertj.core.api.Assertions.assertThat;

class TimeUtilsTest {

    private static final Instant T0 = Instant.parse("2026-03-02T10:00:00Z");

    @Test
    void convertsNanosToMillis() {
        assertThat(TimeUtils.nanosToMillis(5_999_999L)).isEqualTo(5L);
        assertThat(TimeUtils.nanosToMillis(0L)).isZero();
    }

    @Test
    void deadlineIsDueAtTheBoundary() {
        Duration grace = Duration.ofSeconds(30);

        assertThat(TimeUtils.isDue(T0, grace, T0.plusMillis(29_999))).isFalse();
        assertThat(TimeUtils.isDue(T0, grace, T0.plusSeconds(30))).isTrue();
        assertThat(TimeUtils.isDue(null, grace, T0.plusSeconds(600))).isFalse();
    }

    @Test
    void windowExcludesItsEnd() {
        Duration interval = Duration.ofMillis(500);

        assertThat(TimeUtils.withinWindow(T0, interval, T0.plusMillis(80))).isTrue();
        assertThat(TimeUtils.withinWindow(T0, interval, T0.plusMillis(500))).isFalse();
        assertThat(TimeUtils.withinWindow(null, interval, T0)).isFalse();
    }
}
