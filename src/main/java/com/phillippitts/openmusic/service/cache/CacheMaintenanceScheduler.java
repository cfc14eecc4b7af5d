package com.phillippitts.openmusic.service.cache;

import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.scheduling.annotation.Scheduled;
import org.springframework.stereotype.Component;

/**
 * Runs the cache optimization pass periodically (default every 5 minutes).
 *
 * <p>Disabled with {@code cache.maintenance.enabled=false}. The pass only touches cache
 * bookkeeping, so it never interferes with in-flight resolutions.
 */
@Component
@ConditionalOnProperty(prefix = "cache.maintenance", name = "enabled", havingValue = "true", matchIfMissing = true)
class CacheMaintenanceScheduler {

    private static final Logger LOG = LogManager.getLogger(CacheMaintenanceScheduler.class);

    private final AdaptiveCache cache;

    CacheMaintenanceScheduler(AdaptiveCache cache) {
        this.cache = cache;
    }

    @Scheduled(fixedRateString = "${cache.maintenance.interval-ms:300000}",
            initialDelayString = "${cache.maintenance.interval-ms:300000}")
    void runMaintenance() {
        try {
            OptimizationReport report = cache.optimize();
            LOG.debug("Cache maintenance done: pressure={}, expired={}, evicted={}",
                    report.pressure(), report.expiredRemoved(), report.evicted());
        } catch (RuntimeException e) {
            LOG.error("Cache maintenance pass failed; will retry on next run", e);
        }
    }
}
