package com.phillippitts.openmusic.service.resolver;

import com.phillippitts.openmusic.config.properties.ResolverProperties;
import com.phillippitts.openmusic.domain.BackendConfig;
import com.phillippitts.openmusic.domain.Item;
import com.phillippitts.openmusic.exception.AllBackendsFailedException;
import com.phillippitts.openmusic.exception.BackendException;
import com.phillippitts.openmusic.exception.BackendTimeoutException;
import com.phillippitts.openmusic.exception.BackendUnavailableException;
import com.phillippitts.openmusic.exception.NoResultsException;
import com.phillippitts.openmusic.service.cache.AdaptiveCache;
import com.phillippitts.openmusic.service.cache.CachedSearch;
import com.phillippitts.openmusic.service.resolver.event.AttemptOutcome;
import com.phillippitts.openmusic.service.resolver.event.BackendAttemptEvent;
import com.phillippitts.openmusic.service.resolver.event.ResolutionExhaustedEvent;
import com.phillippitts.openmusic.service.source.SourceAdapter;
import com.phillippitts.openmusic.service.source.SourceAdapters;
import com.phillippitts.openmusic.service.source.StreamUrlProvider;
import com.phillippitts.openmusic.util.LogSanitizer;
import com.phillippitts.openmusic.util.TimeUtils;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.context.ApplicationEventPublisher;
import org.springframework.stereotype.Service;

import java.time.Duration;
import java.util.ArrayList;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Objects;
import java.util.Optional;
import java.util.Set;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionException;
import java.util.concurrent.Executor;
import java.util.concurrent.RejectedExecutionException;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;
import java.util.function.Function;

/**
 * Resolves a free-text query or a URL to playable items by walking the backend chain in
 * priority order.
 *
 * <p>Per backend: every invocation runs on the resolver executor under the backend's own
 * deadline. Timeouts are retried up to {@code maxRetries} attempts with exponential backoff;
 * protocol errors and unavailability move on to the next backend at once; an empty answer
 * moves on without counting as an error. The first non-empty answer wins, is ranked, cached
 * and returned.
 *
 * <p>When the whole chain came back empty, corrected forms of the query are tried within a
 * shared time budget before giving up. If every backend that was tried failed with an error,
 * the resulting exception is {@link AllBackendsFailedException} and carries the last error.
 *
 * <p>Thread-safe: per-call state lives on the caller's stack. A timed-out invocation is
 * abandoned, not awaited; the adapter's own I/O deadline ends it and its result is discarded.
 */
@Service
public class HierarchicalResolver {

    private static final Logger LOG = LogManager.getLogger(HierarchicalResolver.class);

    private static final long NO_DEADLINE = Long.MAX_VALUE;

    private final BackendRegistry registry;
    private final SourceAdapters adapters;
    private final AdaptiveCache cache;
    private final Executor executor;
    private final ApplicationEventPublisher publisher;
    private final ResolverProperties properties;
    private final ExponentialBackoff backoff;
    private final Sleeper sleeper;

    @Autowired
    public HierarchicalResolver(BackendRegistry registry,
                                SourceAdapters adapters,
                                AdaptiveCache cache,
                                @Qualifier("resolverExecutor") Executor executor,
                                ApplicationEventPublisher publisher,
                                ResolverProperties properties) {
        this(registry, adapters, cache, executor, publisher, properties, Sleeper.THREAD);
    }

    HierarchicalResolver(BackendRegistry registry,
                         SourceAdapters adapters,
                         AdaptiveCache cache,
                         Executor executor,
                         ApplicationEventPublisher publisher,
                         ResolverProperties properties,
                         Sleeper sleeper) {
        this.registry = Objects.requireNonNull(registry, "registry");
        this.adapters = Objects.requireNonNull(adapters, "adapters");
        this.cache = Objects.requireNonNull(cache, "cache");
        this.executor = Objects.requireNonNull(executor, "executor");
        this.publisher = Objects.requireNonNull(publisher, "publisher");
        this.properties = Objects.requireNonNull(properties, "properties");
        this.backoff = new ExponentialBackoff(properties.getBackoffBase(), properties.getBackoffCap());
        this.sleeper = Objects.requireNonNull(sleeper, "sleeper");
    }

    /** Resolves with the configured default limit. */
    public List<Item> resolve(String input) {
        return resolve(input, properties.getDefaultLimit());
    }

    /**
     * Resolves {@code input} to at most {@code limit} items, best first.
     *
     * @param input free-text query or http(s) URL
     * @param limit requested result count, clamped to {@code [1, resolver.max-limit]}
     * @return a non-empty list
     * @throws IllegalArgumentException if input is blank
     * @throws NoResultsException if no backend produced anything
     * @throws AllBackendsFailedException if every attempted backend failed with an error
     */
    public List<Item> resolve(String input, int limit) {
        if (input == null || input.isBlank()) {
            throw new IllegalArgumentException("Query must not be blank");
        }
        String query = input.trim();
        int effectiveLimit = Math.max(1, Math.min(limit, properties.getMaxLimit()));
        long start = System.nanoTime();

        List<BackendConfig> chain = registry.enabledByPriority();
        Attempts attempts = new Attempts();
        if (chain.isEmpty()) {
            LOG.warn("No backend enabled, cannot resolve '{}'", LogSanitizer.query(query));
            throw exhausted(query, attempts);
        }

        if (QueryNormalizer.isUrl(query)) {
            Optional<Item> direct = resolveUrl(query, chain, attempts);
            if (direct.isPresent()) {
                return List.of(direct.get());
            }
            if (attempts.claimed) {
                throw exhausted(query, attempts);
            }
            LOG.debug("No backend claims URL {}, treating it as a search query", LogSanitizer.redactUrl(query));
        }

        String cacheKey = QueryNormalizer.cacheKey(query);
        if (!cacheKey.isEmpty()) {
            Optional<CachedSearch> cached = cache.searchResults().get(cacheKey);
            if (cached.isPresent() && cached.get().satisfies(effectiveLimit)) {
                LOG.debug("Search cache hit for '{}'", LogSanitizer.query(query));
                return truncate(cached.get().items(), effectiveLimit);
            }
        }

        List<Item> found = searchChain(query, effectiveLimit, chain, attempts, NO_DEADLINE);
        if (!found.isEmpty()) {
            LOG.info("Resolved '{}' to {} items in {}ms", LogSanitizer.query(query), found.size(),
                    TimeUtils.elapsedMillis(start));
            return remember(cacheKey, found, effectiveLimit);
        }

        found = searchCorrections(query, effectiveLimit, attempts);
        if (!found.isEmpty()) {
            return remember(cacheKey, found, effectiveLimit);
        }
        throw exhausted(query, attempts);
    }

    /**
     * Returns a playable stream URL for {@code item}, from the stream cache or from the first
     * stream-capable backend that accepts the item's URL.
     *
     * @throws NoResultsException if no backend produced a stream URL
     */
    public String resolveStreamUrl(Item item) {
        Objects.requireNonNull(item, "item");
        String url = item.canonicalUrl();
        Optional<String> cached = cache.streamUrls().get(url);
        if (cached.isPresent()) {
            return cached.get();
        }

        Attempts attempts = new Attempts();
        for (BackendConfig config : registry.enabledByPriority()) {
            SourceAdapter adapter = adapterFor(config);
            if (!(adapter instanceof StreamUrlProvider provider) || !adapter.isValidUrl(url)) {
                continue;
            }
            List<String> streams = attempt(config, adapter, "stream",
                    a -> provider.streamUrl(item).map(List::of).orElse(List.of()), NO_DEADLINE, attempts);
            if (!streams.isEmpty()) {
                cache.streamUrls().put(url, streams.get(0));
                return streams.get(0);
            }
        }
        throw exhausted(url, attempts);
    }

    /** Drops the cached stream URL of an item, typically after playback failed on it. */
    public void invalidateStreamUrl(String canonicalUrl) {
        cache.streamUrls().invalidate(canonicalUrl);
    }

    private Optional<Item> resolveUrl(String url, List<BackendConfig> chain, Attempts attempts) {
        Optional<Item> cached = cache.metadata().get(url);
        if (cached.isPresent()) {
            return cached;
        }
        for (BackendConfig config : chain) {
            SourceAdapter adapter = adapterFor(config);
            if (adapter == null || !adapter.supportsDirectResolution() || !adapter.isValidUrl(url)) {
                continue;
            }
            attempts.claimed = true;
            List<Item> items = attempt(config, adapter, "resolve",
                    a -> a.resolve(url).map(List::of).orElse(List.of()), NO_DEADLINE, attempts);
            if (!items.isEmpty()) {
                Item item = items.get(0);
                cache.metadata().put(url, item);
                if (!url.equals(item.canonicalUrl())) {
                    cache.metadata().put(item.canonicalUrl(), item);
                }
                return Optional.of(item);
            }
        }
        return Optional.empty();
    }

    private List<Item> searchChain(String query, int limit, List<BackendConfig> chain,
                                   Attempts attempts, long deadlineNanos) {
        for (BackendConfig config : chain) {
            if (!config.isEnabled()) {
                continue;
            }
            SourceAdapter adapter = adapterFor(config);
            if (adapter == null || !adapter.supportsSearch()) {
                continue;
            }
            if (deadlineNanos != NO_DEADLINE && System.nanoTime() >= deadlineNanos) {
                LOG.debug("Fallback budget spent before backend {}", config.getName());
                return List.of();
            }
            List<Item> items = attempt(config, adapter, "search", a -> a.search(query, limit),
                    deadlineNanos, attempts);
            if (!items.isEmpty()) {
                List<Item> ranked = ResultRanker.rank(items, query);
                for (Item item : ranked) {
                    cache.metadata().put(item.canonicalUrl(), item);
                }
                return ranked;
            }
        }
        return List.of();
    }

    private List<Item> searchCorrections(String query, int limit, Attempts attempts) {
        List<String> corrections = QueryNormalizer.fallbackQueries(query);
        if (corrections.isEmpty()) {
            return List.of();
        }
        long deadline = System.nanoTime() + properties.getFallbackBudget().toNanos();
        for (String corrected : corrections) {
            if (System.nanoTime() >= deadline) {
                LOG.info("Fallback budget of {}ms spent for '{}'", properties.getFallbackBudget().toMillis(),
                        LogSanitizer.query(query));
                break;
            }
            LOG.debug("Retrying '{}' as '{}'", LogSanitizer.query(query), LogSanitizer.query(corrected));
            List<Item> items = searchChain(corrected, limit, registry.enabledByPriority(), attempts, deadline);
            if (!items.isEmpty()) {
                LOG.info("Resolved '{}' via corrected query '{}'", LogSanitizer.query(query),
                        LogSanitizer.query(corrected));
                return items;
            }
        }
        return List.of();
    }

    /**
     * Invokes one backend with retries on timeout. Returns an empty list when the backend
     * produced nothing or failed; failures are recorded in {@code attempts}.
     */
    private <T> List<T> attempt(BackendConfig config, SourceAdapter adapter, String operation,
                                Function<SourceAdapter, List<T>> call, long deadlineNanos, Attempts attempts) {
        attempts.attempted.add(config.getName());
        int maxAttempts = config.getMaxRetries();
        for (int n = 1; n <= maxAttempts; n++) {
            Duration timeout = config.getTimeout();
            if (deadlineNanos != NO_DEADLINE) {
                long remaining = deadlineNanos - System.nanoTime();
                if (remaining <= 0) {
                    return List.of();
                }
                timeout = TimeUtils.min(timeout, Duration.ofNanos(remaining));
            }

            long startNanos = System.nanoTime();
            try {
                List<T> result = invoke(config, adapter, call, timeout);
                Duration elapsed = Duration.ofNanos(System.nanoTime() - startNanos);
                if (result == null || result.isEmpty()) {
                    publish(config, operation, n, AttemptOutcome.EMPTY, elapsed, "");
                    attempts.empty++;
                    return List.of();
                }
                publish(config, operation, n, AttemptOutcome.SUCCESS, elapsed, "");
                return result;
            } catch (BackendException e) {
                Duration elapsed = Duration.ofNanos(System.nanoTime() - startNanos);
                publish(config, operation, n, AttemptOutcome.of(e.getKind()), elapsed, e.getMessage());
                attempts.lastError = e;
                switch (e.getKind()) {
                    case TIMEOUT -> {
                        if (n == maxAttempts) {
                            LOG.warn("Backend {} timed out {} time(s), moving on", config.getName(), n);
                        } else if (!pauseBeforeRetry(n, deadlineNanos)) {
                            return List.of();
                        }
                    }
                    case PROTOCOL -> {
                        LOG.warn("Backend {} returned malformed data, skipping: {}", config.getName(), e.getMessage());
                        return List.of();
                    }
                    case UNAVAILABLE -> {
                        LOG.warn("Backend {} unavailable: {}", config.getName(), e.getMessage());
                        return List.of();
                    }
                }
            }
        }
        return List.of();
    }

    private <T> List<T> invoke(BackendConfig config, SourceAdapter adapter,
                               Function<SourceAdapter, List<T>> call, Duration timeout) {
        CompletableFuture<List<T>> future;
        try {
            future = CompletableFuture.supplyAsync(() -> call.apply(adapter), executor);
        } catch (RejectedExecutionException e) {
            throw new BackendUnavailableException("Resolver pool saturated, call not started", config.getName(), e);
        }
        try {
            return future.orTimeout(timeout.toMillis(), TimeUnit.MILLISECONDS).join();
        } catch (CompletionException e) {
            Throwable cause = e.getCause() == null ? e : e.getCause();
            if (cause instanceof TimeoutException) {
                future.cancel(true);
                throw new BackendTimeoutException("No answer within " + timeout.toMillis() + "ms",
                        config.getName());
            }
            if (cause instanceof BackendException be) {
                throw be;
            }
            throw new BackendUnavailableException("Unexpected adapter failure: " + cause, config.getName(), cause);
        }
    }

    /** Sleeps the backoff delay; false when interrupted or the deadline leaves no room. */
    private boolean pauseBeforeRetry(int failedAttempt, long deadlineNanos) {
        Duration delay = backoff.delay(failedAttempt);
        if (deadlineNanos != NO_DEADLINE) {
            long remaining = deadlineNanos - System.nanoTime();
            if (remaining <= delay.toNanos()) {
                return false;
            }
        }
        try {
            sleeper.sleep(delay);
            return true;
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            return false;
        }
    }

    private SourceAdapter adapterFor(BackendConfig config) {
        Optional<SourceAdapter> adapter = adapters.forKind(config.getKind());
        if (adapter.isEmpty()) {
            LOG.debug("No adapter for backend {} ({})", config.getName(), config.getKind());
        }
        return adapter.orElse(null);
    }

    private void publish(BackendConfig config, String operation, int attempt, AttemptOutcome outcome,
                         Duration elapsed, String detail) {
        publisher.publishEvent(new BackendAttemptEvent(config.getName(), config.getKind(), operation, attempt,
                outcome, elapsed, detail == null ? "" : detail));
    }

    private List<Item> remember(String cacheKey, List<Item> ranked, int limit) {
        if (!cacheKey.isEmpty()) {
            cache.searchResults().put(cacheKey, new CachedSearch(truncate(ranked, limit), limit));
        }
        return truncate(ranked, limit);
    }

    private static List<Item> truncate(List<Item> items, int limit) {
        return items.size() <= limit ? items : List.copyOf(items.subList(0, limit));
    }

    private NoResultsException exhausted(String query, Attempts attempts) {
        List<String> attempted = new ArrayList<>(attempts.attempted);
        boolean allFailed = attempts.allFailed();
        publisher.publishEvent(new ResolutionExhaustedEvent(query, attempted, allFailed));
        if (allFailed) {
            return new AllBackendsFailedException(query, attempted, attempts.lastError);
        }
        return new NoResultsException(query, attempted);
    }

    /** Book-keeping of a single resolution call. */
    private static final class Attempts {
        final Set<String> attempted = new LinkedHashSet<>();
        BackendException lastError;
        int empty;
        boolean claimed;

        boolean allFailed() {
            return lastError != null && empty == 0;
        }
    }
}
