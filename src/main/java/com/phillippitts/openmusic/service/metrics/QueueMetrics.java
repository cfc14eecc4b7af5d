package com.phillippitts.openmusic.service.metrics;

import com.phillippitts.openmusic.service.queue.event.ItemQuarantinedEvent;
import com.phillippitts.openmusic.service.queue.event.RecoveryModeChangedEvent;
import com.phillippitts.openmusic.service.queue.event.RecoveryReadmissionEvent;
import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.MeterRegistry;
import org.springframework.context.event.EventListener;
import org.springframework.stereotype.Component;

/**
 * Playback queue instrumentation: reported outcomes, quarantines and recovery activity.
 */
@Component
public class QueueMetrics {

    private static final String METRIC_PREFIX = "openmusic.queue";

    private final MeterRegistry registry;

    public QueueMetrics(MeterRegistry registry) {
        this.registry = registry;
    }

    /**
     * Counts a playback outcome reported by the playback collaborator.
     *
     * @param success whether the attempt succeeded
     */
    public void recordPlayback(boolean success) {
        Counter.builder(METRIC_PREFIX + (success ? ".successes" : ".failures"))
                .description(success ? "Successful playback reports" : "Failed playback reports")
                .register(registry)
                .increment();
    }

    @EventListener
    public void onQuarantined(ItemQuarantinedEvent event) {
        Counter.builder(METRIC_PREFIX + ".quarantined")
                .description("Items moved to the failed list")
                .register(registry)
                .increment();
    }

    @EventListener
    public void onReadmission(RecoveryReadmissionEvent event) {
        Counter.builder(METRIC_PREFIX + ".recoveries")
                .description("Quarantined items re-admitted for another attempt")
                .register(registry)
                .increment(event.urls().size());
    }

    @EventListener
    public void onRecoveryMode(RecoveryModeChangedEvent event) {
        if (event.active()) {
            Counter.builder(METRIC_PREFIX + ".recovery.mode.entered")
                    .description("Times a queue entered recovery mode")
                    .register(registry)
                    .increment();
        }
    }
}
