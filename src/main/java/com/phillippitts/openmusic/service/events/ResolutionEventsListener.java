package com.phillippitts.openmusic.service.events;

import com.phillippitts.openmusic.service.queue.event.ItemQuarantinedEvent;
import com.phillippitts.openmusic.service.queue.event.RecoveryModeChangedEvent;
import com.phillippitts.openmusic.service.resolver.event.AttemptOutcome;
import com.phillippitts.openmusic.service.resolver.event.BackendAttemptEvent;
import com.phillippitts.openmusic.service.resolver.event.ResolutionExhaustedEvent;
import com.phillippitts.openmusic.util.LogSanitizer;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import org.springframework.context.event.EventListener;
import org.springframework.stereotype.Component;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Operator-facing log lines for resolver and queue events. Throttled per key to avoid log spam.
 */
@Component
class ResolutionEventsListener {
    private static final Logger LOG = LogManager.getLogger(ResolutionEventsListener.class);

    private static final Duration THROTTLE = Duration.ofMinutes(1);

    private final Map<String, Instant> lastLog = new ConcurrentHashMap<>();
    private final Clock clock;

    ResolutionEventsListener(Clock clock) {
        this.clock = clock;
    }

    @EventListener
    void onAttempt(BackendAttemptEvent e) {
        if (e.outcome() == AttemptOutcome.UNAVAILABLE && shouldLog("unavailable-" + e.backend())) {
            LOG.warn("Backend {} is unavailable: {}. Check its configuration or disable it.",
                    e.backend(), LogSanitizer.truncate(e.detail(), 200));
        }
    }

    @EventListener
    void onExhausted(ResolutionExhaustedEvent e) {
        if (e.allFailed() && shouldLog("all-failed")) {
            LOG.warn("Every backend failed for '{}' (attempted: {})", LogSanitizer.query(e.query()),
                    e.attemptedBackends());
        }
    }

    @EventListener
    void onQuarantined(ItemQuarantinedEvent e) {
        if (shouldLog("quarantine-" + e.sessionId() + '-' + e.url())) {
            LOG.warn("Session {}: '{}' quarantined after {} failures", e.sessionId(),
                    LogSanitizer.truncate(e.title(), 80), e.failureCount());
        }
    }

    @EventListener
    void onRecoveryMode(RecoveryModeChangedEvent e) {
        if (!e.active()) {
            LOG.info("Session {}: recovery mode cleared", e.sessionId());
        } else if (shouldLog("recovery-" + e.sessionId())) {
            LOG.warn("Session {}: recovery mode after {} consecutive failures", e.sessionId(),
                    e.consecutiveFailures());
        }
    }

    // Package-private for tests
    boolean shouldLog(String key) {
        Instant now = clock.instant();
        Instant prev = lastLog.get(key);
        if (prev == null || Duration.between(prev, now).compareTo(THROTTLE) > 0) {
            lastLog.put(key, now);
            return true;
        }
        return false;
    }
}
