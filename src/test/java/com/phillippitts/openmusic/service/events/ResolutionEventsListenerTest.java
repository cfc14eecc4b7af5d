package com.phillippitts.openmusic.service.events;

import com.phillippitts.openmusic.domain.SourceKind;
import com.phillippitts.openmusic.service.queue.event.ItemQuarantinedEvent;
import com.phillippitts.openmusic.service.queue.event.RecoveryModeChangedEvent;
import com.phillippitts.openmusic.service.resolver.event.AttemptOutcome;
import com.phillippitts.openmusic.service.resolver.event.BackendAttemptEvent;
import com.phillippitts.openmusic.service.resolver.event.ResolutionExhaustedEvent;
import com.phillippitts.openmusic.testutil.MutableClock;
import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.time.Instant;
import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatCode;

class ResolutionEventsListenerTest {

    private final MutableClock clock = new MutableClock();

    @Test
    void throttlesRepeatLogs() {
        ResolutionEventsListener l = new ResolutionEventsListener(clock);
        // shouldLog allows first occurrence
        assertThat(l.shouldLog("unavailable-yt-dlp")).isTrue();
        // but rejects immediately repeated
        assertThat(l.shouldLog("unavailable-yt-dlp")).isFalse();
        assertThat(l.shouldLog("unavailable-invidious")).isTrue();

        clock.advance(Duration.ofMinutes(1).plusSeconds(1));
        assertThat(l.shouldLog("unavailable-yt-dlp")).isTrue();
    }

    @Test
    void handlersDoNotThrow() {
        ResolutionEventsListener l = new ResolutionEventsListener(clock);
        Instant now = clock.instant();
        assertThatCode(() -> {
            l.onAttempt(new BackendAttemptEvent("yt-dlp", SourceKind.PRIMARY_EXTRACTOR, "search", 1,
                    AttemptOutcome.UNAVAILABLE, Duration.ofMillis(3), "binary not found"));
            l.onExhausted(new ResolutionExhaustedEvent("some query", List.of("yt-dlp"), true));
            l.onQuarantined(new ItemQuarantinedEvent("s1", "https://example.com/a", "a", 3, now));
            l.onRecoveryMode(new RecoveryModeChangedEvent("s1", true, 3, now));
            l.onRecoveryMode(new RecoveryModeChangedEvent("s1", false, 0, now));
        }).doesNotThrowAnyException();
    }
}
