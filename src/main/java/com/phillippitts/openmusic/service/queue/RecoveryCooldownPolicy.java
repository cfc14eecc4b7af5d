package com.phillippitts.openmusic.service.queue;

import com.phillippitts.openmusic.config.properties.QueueProperties;

import java.time.Duration;
import java.util.Objects;

/**
 * Wait time after the last reported failure before a quarantined item is given another
 * attempt, as a function of how many recovery rounds that item has already been through.
 */
@FunctionalInterface
public interface RecoveryCooldownPolicy {

    /**
     * @param rounds recovery rounds the item already went through (0 on first quarantine)
     */
    Duration cooldownFor(int rounds);

    /** Same cooldown regardless of history. */
    static RecoveryCooldownPolicy flat(Duration cooldown) {
        Objects.requireNonNull(cooldown, "cooldown");
        return rounds -> cooldown;
    }

    /** {@code base * 2^rounds}, never above {@code max}. */
    static RecoveryCooldownPolicy exponential(Duration base, Duration max) {
        Objects.requireNonNull(base, "base");
        Objects.requireNonNull(max, "max");
        return rounds -> {
            int shift = Math.max(0, Math.min(rounds, 30));
            long millis = base.toMillis() << shift;
            if (millis < 0 || millis > max.toMillis()) {
                return max;
            }
            return Duration.ofMillis(millis);
        };
    }

    static RecoveryCooldownPolicy from(QueueProperties properties) {
        return switch (properties.getCooldownPolicy()) {
            case FLAT -> flat(properties.getRecoveryCooldown());
            case EXPONENTIAL -> exponential(properties.getRecoveryCooldown(), properties.getMaxRecoveryCooldown());
        };
    }
}
