package com.phillippitts.openmusic.service.metrics;

import com.phillippitts.openmusic.service.resolver.event.BackendAttemptEvent;
import com.phillippitts.openmusic.service.resolver.event.ResolutionExhaustedEvent;
import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.Timer;
import org.springframework.context.event.EventListener;
import org.springframework.stereotype.Component;

import java.util.Locale;

/**
 * Resolver instrumentation fed by resolver events.
 *
 * <p>Provides:
 * <ul>
 *   <li>Attempt counts per backend and outcome (success, empty, timeout, protocol_error, unavailable)</li>
 *   <li>Attempt latency per backend</li>
 *   <li>Resolutions that ended without a result</li>
 * </ul>
 *
 * <p>All metrics are exposed via Micrometer and available at /actuator/prometheus.
 */
@Component
public class ResolutionMetrics {

    private static final String METRIC_PREFIX = "openmusic.resolver";

    private final MeterRegistry registry;

    public ResolutionMetrics(MeterRegistry registry) {
        this.registry = registry;
    }

    @EventListener
    public void onAttempt(BackendAttemptEvent event) {
        Counter.builder(METRIC_PREFIX + ".attempts")
                .description("Backend invocations by outcome")
                .tag("backend", event.backend())
                .tag("outcome", event.outcome().name().toLowerCase(Locale.ROOT))
                .register(registry)
                .increment();
        Timer.builder(METRIC_PREFIX + ".latency")
                .description("Time taken by a single backend invocation")
                .tag("backend", event.backend())
                .register(registry)
                .record(event.elapsed());
    }

    @EventListener
    public void onExhausted(ResolutionExhaustedEvent event) {
        Counter.builder(METRIC_PREFIX + ".exhausted")
                .description("Resolutions that ended without a result")
                .tag("all_failed", Boolean.toString(event.allFailed()))
                .register(registry)
                .increment();
    }
}
