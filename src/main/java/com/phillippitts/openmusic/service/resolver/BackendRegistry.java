package com.phillippitts.openmusic.service.resolver;

import com.phillippitts.openmusic.config.properties.ResolverProperties;
import com.phillippitts.openmusic.domain.BackendConfig;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Component;

import java.time.Duration;
import java.util.Collection;
import java.util.Comparator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * Runtime backend policies, seeded from {@code resolver.backends[*]}.
 *
 * <p>The set of backends is fixed at startup; their fields can be changed while running via
 * {@link #update}. Readers always receive the live {@link BackendConfig} objects, so a change
 * is seen by the next attempt of any in-flight resolution.
 */
@Component
public class BackendRegistry {

    private static final Logger LOG = LogManager.getLogger(BackendRegistry.class);

    private static final Comparator<BackendConfig> BY_PRIORITY =
            Comparator.comparingInt(BackendConfig::getPriority);

    private final Map<String, BackendConfig> backends;

    @Autowired
    public BackendRegistry(ResolverProperties properties) {
        this(properties.getBackends().stream()
                .map(b -> new BackendConfig(b.getName(), b.getKind(), b.getPriority(), b.getTimeout(),
                        b.getMaxRetries(), b.isEnabled()))
                .toList());
    }

    public BackendRegistry(List<BackendConfig> configs) {
        Map<String, BackendConfig> byName = new LinkedHashMap<>();
        for (BackendConfig config : configs) {
            if (byName.putIfAbsent(config.getName(), config) != null) {
                throw new IllegalStateException("Duplicate backend name: " + config.getName());
            }
        }
        this.backends = byName;
        LOG.info("Backend chain: {}", enabledByPriority().stream().map(BackendConfig::getName).toList());
    }

    /**
     * Enabled backends, lowest priority value first. Ties keep configuration order.
     * A fresh list on every call.
     */
    public List<BackendConfig> enabledByPriority() {
        return backends.values().stream()
                .filter(BackendConfig::isEnabled)
                .sorted(BY_PRIORITY)
                .toList();
    }

    public Collection<BackendConfig> all() {
        return List.copyOf(backends.values());
    }

    public Optional<BackendConfig> find(String name) {
        return Optional.ofNullable(backends.get(name));
    }

    /**
     * Applies the non-null fields of {@code update} to the named backend.
     *
     * @throws IllegalArgumentException if no backend has that name or a value is invalid
     */
    public BackendConfig update(String name, BackendUpdate update) {
        BackendConfig config = find(name)
                .orElseThrow(() -> new IllegalArgumentException("Unknown backend: " + name));
        // Validate everything first so a rejected update leaves the backend untouched
        if (update.timeout() != null && (update.timeout().isNegative() || update.timeout().isZero())) {
            throw new IllegalArgumentException("timeout must be positive: " + update.timeout());
        }
        if (update.maxRetries() != null && update.maxRetries() < 1) {
            throw new IllegalArgumentException("maxRetries must be >= 1: " + update.maxRetries());
        }
        synchronized (config) {
            if (update.timeout() != null) {
                config.setTimeout(update.timeout());
            }
            if (update.maxRetries() != null) {
                config.setMaxRetries(update.maxRetries());
            }
            if (update.priority() != null) {
                config.setPriority(update.priority());
            }
            if (update.enabled() != null) {
                config.setEnabled(update.enabled());
            }
        }
        LOG.info("Backend updated: {}", config);
        return config;
    }

    /**
     * Partial backend change; null fields are left untouched.
     */
    public record BackendUpdate(Boolean enabled, Duration timeout, Integer maxRetries, Integer priority) {
    }
}
