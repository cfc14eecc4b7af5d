package com.phillippitts.openmusic.service.cache;

import com.phillippitts.openmusic.config.properties.CacheProperties;
import com.phillippitts.openmusic.testutil.MutableClock;
import org.junit.jupiter.api.Test;

import java.time.Duration;

import static org.assertj.core.api.Assertions.assertThat;

class MemoryPressureTest {

    @Test
    void classifiesAgainstThresholds() {
        assertThat(MemoryPressure.classify(0.50, 0.70, 0.85, 0.95)).isEqualTo(MemoryPressure.LOW);
        assertThat(MemoryPressure.classify(0.70, 0.70, 0.85, 0.95)).isEqualTo(MemoryPressure.LOW);
        assertThat(MemoryPressure.classify(0.71, 0.70, 0.85, 0.95)).isEqualTo(MemoryPressure.MEDIUM);
        assertThat(MemoryPressure.classify(0.90, 0.70, 0.85, 0.95)).isEqualTo(MemoryPressure.HIGH);
        assertThat(MemoryPressure.classify(0.99, 0.70, 0.85, 0.95)).isEqualTo(MemoryPressure.CRITICAL);
    }

    @Test
    void onlyHighAndCriticalEvictProportionally() {
        assertThat(MemoryPressure.LOW.evictionPercent()).isZero();
        assertThat(MemoryPressure.MEDIUM.evictionPercent()).isZero();
        assertThat(MemoryPressure.HIGH.evictionPercent()).isEqualTo(25);
        assertThat(MemoryPressure.CRITICAL.evictionPercent()).isEqualTo(50);
    }

    @Test
    void monitorReusesSampleWithinInterval() {
        CacheProperties properties = new CacheProperties();
        properties.getPressure().setSampleInterval(Duration.ofSeconds(30));
        MutableClock clock = new MutableClock();
        double[] ratio = {0.5};
        int[] samples = {0};
        JvmMemoryPressureMonitor monitor = new JvmMemoryPressureMonitor(properties, clock) {
            @Override
            double usedRatio() {
                samples[0]++;
                return ratio[0];
            }
        };

        assertThat(monitor.currentPressure()).isEqualTo(MemoryPressure.LOW);
        ratio[0] = 0.97;
        assertThat(monitor.currentPressure()).isEqualTo(MemoryPressure.LOW);
        assertThat(samples[0]).isEqualTo(1);

        clock.advance(Duration.ofSeconds(30));
        assertThat(monitor.currentPressure()).isEqualTo(MemoryPressure.CRITICAL);
        assertThat(samples[0]).isEqualTo(2);
    }

    @Test
    void realHeapRatioIsAFraction() {
        JvmMemoryPressureMonitor monitor = new JvmMemoryPressureMonitor(new CacheProperties(), new MutableClock());
        assertThat(monitor.usedRatio()).isBetween(0.0, 1.0);
    }
}
