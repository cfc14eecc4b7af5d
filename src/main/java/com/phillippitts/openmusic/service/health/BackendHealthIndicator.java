package com.phillippitts.openmusic.service.health;

import com.phillippitts.openmusic.domain.BackendConfig;
import com.phillippitts.openmusic.service.resolver.BackendRegistry;
import org.springframework.boot.actuate.health.Health;
import org.springframework.boot.actuate.health.HealthIndicator;
import org.springframework.stereotype.Component;

import java.util.Collection;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Health indicator for the backend chain.
 *
 * <ul>
 *   <li>UP: every configured backend is enabled</li>
 *   <li>DEGRADED: some backends are disabled</li>
 *   <li>DOWN: no backend is enabled</li>
 * </ul>
 *
 * <p>Exposed via /actuator/health endpoint.
 */
@Component
public class BackendHealthIndicator implements HealthIndicator {

    private final BackendRegistry registry;

    public BackendHealthIndicator(BackendRegistry registry) {
        this.registry = registry;
    }

    @Override
    public Health health() {
        Collection<BackendConfig> backends = registry.all();
        Map<String, String> details = new LinkedHashMap<>();
        long enabled = 0;
        for (BackendConfig backend : backends) {
            details.put(backend.getName(), backend.isEnabled()
                    ? "enabled (priority " + backend.getPriority() + ")"
                    : "disabled");
            if (backend.isEnabled()) {
                enabled++;
            }
        }

        Health.Builder builder = new Health.Builder();
        if (enabled > 0 && enabled == backends.size()) {
            builder.up().withDetail("status", "All backends enabled");
        } else if (enabled > 0) {
            builder.status("DEGRADED").withDetail("status", enabled + " of " + backends.size() + " backends enabled");
        } else {
            builder.down().withDetail("status", "No backend enabled");
        }
        return builder.withDetail("backends", details).build();
    }
}
