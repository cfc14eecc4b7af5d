package com.phillippitts.openmusic.config.properties;

import jakarta.validation.Valid;
import jakarta.validation.constraints.DecimalMax;
import jakarta.validation.constraints.DecimalMin;
import jakarta.validation.constraints.NotNull;
import jakarta.validation.constraints.Positive;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.validation.annotation.Validated;

import java.time.Duration;

/**
 * Configuration properties for the adaptive cache.
 *
 * <p>Three independently sized regions share one memory ceiling: stream URLs (keyed by source
 * URL), item metadata (keyed by canonical URL) and search result sets (keyed by normalized query).
 */
@ConfigurationProperties(prefix = "cache")
@Validated
public class CacheProperties {

    /** Memory ceiling shared by all regions, in megabytes. */
    @Positive(message = "Max memory must be positive")
    private long maxMemoryMb = 256;

    @Valid
    private Region stream = new Region(Duration.ofHours(1), 1000);

    @Valid
    private Region metadata = new Region(Duration.ofHours(2), 5000);

    @Valid
    private Region search = new Region(Duration.ofMinutes(30), 500);

    @Valid
    private Maintenance maintenance = new Maintenance();

    @Valid
    private Pressure pressure = new Pressure();

    public long getMaxMemoryMb() {
        return maxMemoryMb;
    }

    public void setMaxMemoryMb(long maxMemoryMb) {
        this.maxMemoryMb = maxMemoryMb;
    }

    public long getMaxMemoryBytes() {
        return maxMemoryMb * 1024L * 1024L;
    }

    public Region getStream() {
        return stream;
    }

    public void setStream(Region stream) {
        this.stream = stream;
    }

    public Region getMetadata() {
        return metadata;
    }

    public void setMetadata(Region metadata) {
        this.metadata = metadata;
    }

    public Region getSearch() {
        return search;
    }

    public void setSearch(Region search) {
        this.search = search;
    }

    public Maintenance getMaintenance() {
        return maintenance;
    }

    public void setMaintenance(Maintenance maintenance) {
        this.maintenance = maintenance;
    }

    public Pressure getPressure() {
        return pressure;
    }

    public void setPressure(Pressure pressure) {
        this.pressure = pressure;
    }

    /**
     * Per-region TTL and entry ceiling.
     */
    public static class Region {

        @NotNull
        private Duration ttl;

        @Positive(message = "Max entries must be positive")
        private int maxEntries;

        public Region() {
            this(Duration.ofHours(1), 1000);
        }

        public Region(Duration ttl, int maxEntries) {
            this.ttl = ttl;
            this.maxEntries = maxEntries;
        }

        public Duration getTtl() {
            return ttl;
        }

        public void setTtl(Duration ttl) {
            this.ttl = ttl;
        }

        public int getMaxEntries() {
            return maxEntries;
        }

        public void setMaxEntries(int maxEntries) {
            this.maxEntries = maxEntries;
        }
    }

    /**
     * Background maintenance pass. The interval itself is read by the scheduler annotation
     * through {@code cache.maintenance.interval-ms}.
     */
    public static class Maintenance {

        private boolean enabled = true;

        @Positive
        private long intervalMs = 300_000;

        public boolean isEnabled() {
            return enabled;
        }

        public void setEnabled(boolean enabled) {
            this.enabled = enabled;
        }

        public long getIntervalMs() {
            return intervalMs;
        }

        public void setIntervalMs(long intervalMs) {
            this.intervalMs = intervalMs;
        }
    }

    /**
     * Memory-pressure classification thresholds (fractions of memory in use).
     */
    public static class Pressure {

        @DecimalMin("0.0")
        @DecimalMax("1.0")
        private double medium = 0.70;

        @DecimalMin("0.0")
        @DecimalMax("1.0")
        private double high = 0.85;

        @DecimalMin("0.0")
        @DecimalMax("1.0")
        private double critical = 0.95;

        /** Minimum time between two memory samples. */
        @NotNull
        private Duration sampleInterval = Duration.ofSeconds(30);

        /** Entries evicted (least frequently used first) under medium pressure. */
        @Positive
        private int mediumEvictionCount = 10;

        /** Whether host memory counts toward the pressure ratio in addition to the JVM heap. */
        private boolean includeHost = false;

        public double getMedium() {
            return medium;
        }

        public void setMedium(double medium) {
            this.medium = medium;
        }

        public double getHigh() {
            return high;
        }

        public void setHigh(double high) {
            this.high = high;
        }

        public double getCritical() {
            return critical;
        }

        public void setCritical(double critical) {
            this.critical = critical;
        }

        public Duration getSampleInterval() {
            return sampleInterval;
        }

        public void setSampleInterval(Duration sampleInterval) {
            this.sampleInterval = sampleInterval;
        }

        public int getMediumEvictionCount() {
            return mediumEvictionCount;
        }

        public void setMediumEvictionCount(int mediumEvictionCount) {
            this.mediumEvictionCount = mediumEvictionCount;
        }

        public boolean isIncludeHost() {
            return includeHost;
        }

        public void setIncludeHost(boolean includeHost) {
            this.includeHost = includeHost;
        }
    }
}
