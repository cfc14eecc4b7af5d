package com.phillippitts.openmusic.config.properties;

import com.phillippitts.openmusic.domain.SourceKind;
import jakarta.validation.Valid;
import jakarta.validation.constraints.Min;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotNull;
import jakarta.validation.constraints.Positive;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.validation.annotation.Validated;

import java.time.Duration;
import java.util.ArrayList;
import java.util.List;

/**
 * Configuration properties for the hierarchical resolver and its backend chain.
 *
 * <p>Example application.properties:
 * <pre>
 * resolver.backends[0].name=yt-dlp
 * resolver.backends[0].kind=PRIMARY_EXTRACTOR
 * resolver.backends[0].priority=1
 * resolver.backends[0].timeout=10s
 * resolver.backends[0].max-retries=1
 * resolver.backoff-base=500ms
 * </pre>
 *
 * <p>Backend values only seed the runtime {@link com.phillippitts.openmusic.domain.BackendConfig}s;
 * later operator changes go through the backend registry.
 */
@ConfigurationProperties(prefix = "resolver")
@Validated
public class ResolverProperties {

    @Valid
    private List<Backend> backends = new ArrayList<>();

    /** Base delay of the exponential backoff between retries of the same backend. */
    @NotNull
    private Duration backoffBase = Duration.ofMillis(500);

    /** Upper bound of a single backoff delay. */
    @NotNull
    private Duration backoffCap = Duration.ofSeconds(4);

    /** Combined deadline for the corrected-query fallback pass across all backends. */
    @NotNull
    private Duration fallbackBudget = Duration.ofSeconds(20);

    @Positive(message = "Default limit must be positive")
    private int defaultLimit = 5;

    @Positive(message = "Max limit must be positive")
    private int maxLimit = 25;

    public List<Backend> getBackends() {
        return backends;
    }

    public void setBackends(List<Backend> backends) {
        this.backends = backends;
    }

    public Duration getBackoffBase() {
        return backoffBase;
    }

    public void setBackoffBase(Duration backoffBase) {
        this.backoffBase = backoffBase;
    }

    public Duration getBackoffCap() {
        return backoffCap;
    }

    public void setBackoffCap(Duration backoffCap) {
        this.backoffCap = backoffCap;
    }

    public Duration getFallbackBudget() {
        return fallbackBudget;
    }

    public void setFallbackBudget(Duration fallbackBudget) {
        this.fallbackBudget = fallbackBudget;
    }

    public int getDefaultLimit() {
        return defaultLimit;
    }

    public void setDefaultLimit(int defaultLimit) {
        this.defaultLimit = defaultLimit;
    }

    public int getMaxLimit() {
        return maxLimit;
    }

    public void setMaxLimit(int maxLimit) {
        this.maxLimit = maxLimit;
    }

    /**
     * One backend entry of the chain.
     */
    public static class Backend {

        @NotBlank(message = "Backend name must not be blank")
        private String name;

        @NotNull(message = "Backend kind must be set")
        private SourceKind kind;

        /** Lower values are tried first. */
        private int priority = 100;

        @NotNull
        private Duration timeout = Duration.ofSeconds(5);

        /** Attempts per resolution call. */
        @Min(value = 1, message = "Max retries must be at least 1")
        private int maxRetries = 1;

        private boolean enabled = true;

        public String getName() {
            return name;
        }

        public void setName(String name) {
            this.name = name;
        }

        public SourceKind getKind() {
            return kind;
        }

        public void setKind(SourceKind kind) {
            this.kind = kind;
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
            this.timeout = timeout;
        }

        public int getMaxRetries() {
            return maxRetries;
        }

        public void setMaxRetries(int maxRetries) {
            this.maxRetries = maxRetries;
        }

        public boolean isEnabled() {
            return enabled;
        }

        public void setEnabled(boolean enabled) {
            this.enabled = enabled;
        }
    }
}
