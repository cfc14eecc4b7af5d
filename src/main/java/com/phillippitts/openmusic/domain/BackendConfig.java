package com.phillippitts.openmusic.domain;

import java.time.Duration;
import java.util.Objects;

/**
 * Runtime policy for one backend adapter.
 *
 * <p>Operators may disable or retime a backend while the application is running, so every
 * mutable field is volatile and the resolver reads this object on each attempt instead of
 * copying its values.
 */
public final class BackendConfig {

    private final String name;
    private final SourceKind kind;
    private volatile int priority;
    private volatile Duration timeout;
    private volatile int maxRetries;
    private volatile boolean enabled;

    public BackendConfig(String name, SourceKind kind, int priority, Duration timeout,
                         int maxRetries, boolean enabled) {
        if (name == null || name.isBlank()) {
            throw new IllegalArgumentException("name must not be blank");
        }
        this.name = name;
        this.kind = Objects.requireNonNull(kind, "kind");
        this.priority = priority;
        setTimeout(timeout);
        setMaxRetries(maxRetries);
        this.enabled = enabled;
    }

    public String getName() {
        return name;
    }

    public SourceKind getKind() {
        return kind;
    }

    public int getPriority() {
        return priority;
    }

    public void setPriority(int priority) {
        this.priority = priority;
    }

    public Duration getTimeout() {
        return timeout;
    }

    public void setTimeout(Duration timeout) {
        Objects.requireNonNull(timeout, "timeout");
        if (timeout.isNegative() || timeout.isZero()) {
            throw new IllegalArgumentException("timeout must be positive: " + timeout);
        }
        this.timeout = timeout;
    }

    /** Number of attempts the resolver makes against this backend per call (at least 1). */
    public int getMaxRetries() {
        return maxRetries;
    }

    public void setMaxRetries(int maxRetries) {
        if (maxRetries < 1) {
            throw new IllegalArgumentException("maxRetries must be >= 1: " + maxRetries);
        }
        this.maxRetries = maxRetries;
    }

    public boolean isEnabled() {
        return enabled;
    }

    public void setEnabled(boolean enabled) {
        this.enabled = enabled;
    }

    @Override
    public String toString() {
        return "BackendConfig{name=" + name + ", kind=" + kind + ", priority=" + priority
                + ", timeout=" + timeout + ", maxRetries=" + maxRetries + ", enabled=" + enabled + '}';
    }
}
