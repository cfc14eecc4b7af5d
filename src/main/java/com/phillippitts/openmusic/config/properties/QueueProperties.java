package com.phillippitts.openmusic.config.properties;

import jakarta.validation.constraints.Min;
import jakarta.validation.constraints.NotNull;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.boot.context.properties.bind.ConstructorBinding;
import org.springframework.validation.annotation.Validated;

import java.time.Duration;

/**
 * Typed properties for per-session playback queues.
 */
@Validated
@ConfigurationProperties(prefix = "queue")
public class QueueProperties {

    /** How the cooldown before re-admitting a quarantined item grows with repeated recoveries. */
    public enum CooldownPolicy { FLAT, EXPONENTIAL }

    @Min(1)
    private final int maxSize;

    @Min(1)
    private final int historySize;

    /** Failed playback attempts after which an item is quarantined. */
    @Min(1)
    private final int maxRetries;

    /** Consecutive failures (any item) that switch the queue into recovery mode. */
    @Min(1)
    private final int consecutiveFailureThreshold;

    @NotNull
    private final Duration recoveryCooldown;

    /** Maximum number of quarantined items re-admitted per recovery round. */
    @Min(1)
    private final int recoveryBatchSize;

    @NotNull
    private final CooldownPolicy cooldownPolicy;

    /** Ceiling for the exponential cooldown policy. */
    @NotNull
    private final Duration maxRecoveryCooldown;

    @ConstructorBinding
    public QueueProperties(Integer maxSize, Integer historySize, Integer maxRetries,
                           Integer consecutiveFailureThreshold, Duration recoveryCooldown,
                           Integer recoveryBatchSize, CooldownPolicy cooldownPolicy,
                           Duration maxRecoveryCooldown) {
        this.maxSize = maxSize == null ? 1000 : maxSize;
        this.historySize = historySize == null ? 50 : historySize;
        this.maxRetries = maxRetries == null ? 3 : maxRetries;
        this.consecutiveFailureThreshold = consecutiveFailureThreshold == null ? 3 : consecutiveFailureThreshold;
        this.recoveryCooldown = recoveryCooldown == null ? Duration.ofMinutes(5) : recoveryCooldown;
        this.recoveryBatchSize = recoveryBatchSize == null ? 3 : recoveryBatchSize;
        this.cooldownPolicy = cooldownPolicy == null ? CooldownPolicy.FLAT : cooldownPolicy;
        this.maxRecoveryCooldown = maxRecoveryCooldown == null ? Duration.ofHours(1) : maxRecoveryCooldown;
    }

    /**
     * All defaults: 1000 pending items, 50 history entries, 3 retries, 5 minute flat cooldown.
     */
    public static QueueProperties defaults() {
        return new QueueProperties(null, null, null, null, null, null, null, null);
    }

    public int getMaxSize() {
        return maxSize;
    }

    public int getHistorySize() {
        return historySize;
    }

    public int getMaxRetries() {
        return maxRetries;
    }

    public int getConsecutiveFailureThreshold() {
        return consecutiveFailureThreshold;
    }

    public Duration getRecoveryCooldown() {
        return recoveryCooldown;
    }

    public int getRecoveryBatchSize() {
        return recoveryBatchSize;
    }

    public CooldownPolicy getCooldownPolicy() {
        return cooldownPolicy;
    }

    public Duration getMaxRecoveryCooldown() {
        return maxRecoveryCooldown;
    }
}
