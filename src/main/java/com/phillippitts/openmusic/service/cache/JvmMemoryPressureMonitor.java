package com.phillippitts.openmusic.service.cache;

import com.phillippitts.openmusic.config.properties.CacheProperties;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import org.springframework.stereotype.Component;

import java.lang.management.ManagementFactory;
import java.lang.management.MemoryUsage;
import java.lang.management.OperatingSystemMXBean;
import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.concurrent.locks.Lock;
import java.util.concurrent.locks.ReentrantLock;

/**
 * Samples JVM heap usage and, when enabled, host physical memory usage, and classifies the
 * higher of the two ratios. Samples are reused for {@code cache.pressure.sample-interval}.
 */
@Component
public class JvmMemoryPressureMonitor implements MemoryPressureMonitor {

    private static final Logger LOG = LogManager.getLogger(JvmMemoryPressureMonitor.class);

    private final CacheProperties.Pressure config;
    private final Clock clock;
    private final Lock lock = new ReentrantLock();

    private Instant lastSample;
    private MemoryPressure lastPressure = MemoryPressure.LOW;

    public JvmMemoryPressureMonitor(CacheProperties properties, Clock clock) {
        this.config = properties.getPressure();
        this.clock = clock;
    }

    @Override
    public MemoryPressure currentPressure() {
        Instant now = clock.instant();
        lock.lock();
        try {
            Duration interval = config.getSampleInterval();
            if (lastSample != null && Duration.between(lastSample, now).compareTo(interval) < 0) {
                return lastPressure;
            }
            double ratio = usedRatio();
            MemoryPressure pressure = MemoryPressure.classify(ratio,
                    config.getMedium(), config.getHigh(), config.getCritical());
            if (pressure != lastPressure) {
                LOG.info("Memory pressure changed: {} -> {} (usedRatio={})",
                        lastPressure, pressure, String.format("%.2f", ratio));
            }
            lastPressure = pressure;
            lastSample = now;
            return pressure;
        } finally {
            lock.unlock();
        }
    }

    double usedRatio() {
        double ratio = heapRatio();
        if (config.isIncludeHost()) {
            ratio = Math.max(ratio, hostRatio());
        }
        return ratio;
    }

    private static double heapRatio() {
        MemoryUsage heap = ManagementFactory.getMemoryMXBean().getHeapMemoryUsage();
        long max = heap.getMax() > 0 ? heap.getMax() : heap.getCommitted();
        return max <= 0 ? 0.0 : (double) heap.getUsed() / max;
    }

    private static double hostRatio() {
        OperatingSystemMXBean os = ManagementFactory.getOperatingSystemMXBean();
        if (os instanceof com.sun.management.OperatingSystemMXBean sunOs) {
            long total = sunOs.getTotalMemorySize();
            long free = sunOs.getFreeMemorySize();
            if (total > 0) {
                return (double) (total - free) / total;
            }
        }
        return 0.0;
    }
}
