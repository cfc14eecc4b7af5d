package com.phillippitts.openmusic.util;

import org.junit.jupiter.api.Test;

import java.time.Duration;

import static org.assertj.core.api.Assertions.assertThat;

class TimeUtilsTest {

    @Test
    void shouldConvertAndTruncateNanosToMillis() {
        assertThat(TimeUtils.nanosToMillis(5_000_000L)).isEqualTo(5L);
        // 2.999 milliseconds truncates to 2 milliseconds
        assertThat(TimeUtils.nanosToMillis(2_999_999L)).isEqualTo(2L);
        assertThat(TimeUtils.nanosToMillis(0L)).isZero();
    }

    @Test
    void shouldCalculateElapsedMillis() throws InterruptedException {
        long startNanos = System.nanoTime();
        Thread.sleep(10);

        assertThat(TimeUtils.elapsedMillis(startNanos)).isGreaterThanOrEqualTo(10L);
    }

    @Test
    void minPicksShorterDuration() {
        assertThat(TimeUtils.min(Duration.ofSeconds(5), Duration.ofSeconds(2))).isEqualTo(Duration.ofSeconds(2));
        assertThat(TimeUtils.min(Duration.ofSeconds(1), Duration.ofSeconds(2))).isEqualTo(Duration.ofSeconds(1));
    }
}
