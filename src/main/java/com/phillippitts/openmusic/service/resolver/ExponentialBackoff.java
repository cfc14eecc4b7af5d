package com.phillippitts.openmusic.service.resolver;

import java.time.Duration;
import java.util.Objects;

/**
 * Delay before retry {@code n + 1} of the same backend: {@code base * 2^(n-1)}, capped.
 */
public final class ExponentialBackoff {

    private final Duration base;
    private final Duration cap;

    public ExponentialBackoff(Duration base, Duration cap) {
        this.base = Objects.requireNonNull(base, "base");
        this.cap = Objects.requireNonNull(cap, "cap");
        if (base.isNegative() || cap.compareTo(base) < 0) {
            throw new IllegalArgumentException("Invalid backoff: base=" + base + ", cap=" + cap);
        }
    }

    /**
     * @param attempt 1-based number of the attempt that just failed
     */
    public Duration delay(int attempt) {
        if (attempt < 1) {
            throw new IllegalArgumentException("attempt must be >= 1: " + attempt);
        }
        int shift = Math.min(attempt - 1, 30);
        long millis = base.toMillis() << shift;
        if (millis < 0 || millis > cap.toMillis()) {
            return cap;
        }
        return Duration.ofMillis(millis);
    }
}
