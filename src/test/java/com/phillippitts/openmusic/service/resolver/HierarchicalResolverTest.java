package com.phillippitts.openmusic.service.resolver;

import com.phillippitts.openmusic.config.properties.CacheProperties;
import com.phillippitts.openmusic.config.properties.ResolverProperties;
import com.phillippitts.openmusic.domain.BackendConfig;
import com.phillippitts.openmusic.domain.Item;
import com.phillippitts.openmusic.domain.SourceKind;
import com.phillippitts.openmusic.exception.AllBackendsFailedException;
import com.phillippitts.openmusic.exception.BackendFailureKind;
import com.phillippitts.openmusic.exception.BackendProtocolException;
import com.phillippitts.openmusic.exception.BackendTimeoutException;
import com.phillippitts.openmusic.exception.BackendUnavailableException;
import com.phillippitts.openmusic.exception.NoResultsException;
import com.phillippitts.openmusic.service.cache.AdaptiveCache;
import com.phillippitts.openmusic.service.cache.MemoryPressure;
import com.phillippitts.openmusic.service.resolver.event.AttemptOutcome;
import com.phillippitts.openmusic.service.resolver.event.BackendAttemptEvent;
import com.phillippitts.openmusic.service.resolver.event.ResolutionExhaustedEvent;
import com.phillippitts.openmusic.service.source.SourceAdapter;
import com.phillippitts.openmusic.service.source.SourceAdapters;
import com.phillippitts.openmusic.testutil.EventCapturingPublisher;
import com.phillippitts.openmusic.testutil.FakeSourceAdapter;
import com.phillippitts.openmusic.testutil.MutableClock;
import com.phillippitts.openmusic.testutil.SyncExecutor;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executor;
import java.util.concurrent.Executors;
import java.util.concurrent.RejectedExecutionException;
import java.util.concurrent.atomic.AtomicInteger;

import static com.phillippitts.openmusic.testutil.TestItems.track;
import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.assertj.core.api.Assertions.tuple;

class HierarchicalResolverTest {

    private FakeSourceAdapter extractor;
    private FakeSourceAdapter mirror;
    private FakeSourceAdapter feed;
    private EventCapturingPublisher publisher;
    private AdaptiveCache cache;
    private ResolverProperties properties;
    private final List<Duration> pauses = new CopyOnWriteArrayList<>();

    @BeforeEach
    void setUp() {
        extractor = new FakeSourceAdapter("yt-dlp", SourceKind.PRIMARY_EXTRACTOR);
        mirror = new FakeSourceAdapter("invidious", SourceKind.MIRROR);
        feed = new FakeSourceAdapter("youtube-feed", SourceKind.FEED);
        publisher = new EventCapturingPublisher();
        cache = new AdaptiveCache(new CacheProperties(), () -> MemoryPressure.LOW, new MutableClock());
        properties = new ResolverProperties();
    }

    private static BackendConfig backend(String name, SourceKind kind, int priority, int maxRetries) {
        return new BackendConfig(name, kind, priority, Duration.ofSeconds(2), maxRetries, true);
    }

    private List<BackendConfig> defaultChain() {
        return List.of(
                backend("yt-dlp", SourceKind.PRIMARY_EXTRACTOR, 1, 2),
                backend("invidious", SourceKind.MIRROR, 2, 1),
                backend("youtube-feed", SourceKind.FEED, 3, 1));
    }

    private HierarchicalResolver resolver(List<BackendConfig> chain) {
        return resolver(new BackendRegistry(chain), new SyncExecutor());
    }

    private HierarchicalResolver resolver(BackendRegistry registry, Executor executor) {
        List<SourceAdapter> all = List.of(extractor, mirror, feed);
        return new HierarchicalResolver(registry, new SourceAdapters(all), cache, executor, publisher,
                properties, pauses::add);
    }

    private List<BackendAttemptEvent> attemptsOf(String backend) {
        return publisher.eventsOf(BackendAttemptEvent.class).stream()
                .filter(e -> e.backend().equals(backend))
                .toList();
    }

    @Test
    void retriesTimeoutsThenFallsThroughToNextBackend() {
        Item hit = track("never gonna give you up");
        extractor.thenSearch(q -> {
            throw new BackendTimeoutException("slow", "yt-dlp");
        }).thenSearch(q -> {
            throw new BackendTimeoutException("slow", "yt-dlp");
        });
        mirror.alwaysReturns(List.of(hit));

        List<Item> result = resolver(defaultChain()).resolve("never gonna give you up");

        assertThat(result).containsExactly(hit);
        assertThat(extractor.searchCalls()).isEqualTo(2);
        assertThat(feed.searchCalls()).isZero();
        assertThat(attemptsOf("yt-dlp"))
                .extracting(BackendAttemptEvent::outcome, BackendAttemptEvent::attempt)
                .containsExactly(
                        tuple(AttemptOutcome.TIMEOUT, 1),
                        tuple(AttemptOutcome.TIMEOUT, 2));
        assertThat(attemptsOf("invidious"))
                .extracting(BackendAttemptEvent::outcome)
                .containsExactly(AttemptOutcome.SUCCESS);
        // One pause between the two attempts, none after the last one
        assertThat(pauses).containsExactly(properties.getBackoffBase());
    }

    @Test
    void protocolErrorIsNotRetried() {
        List<BackendConfig> chain = List.of(
                backend("yt-dlp", SourceKind.PRIMARY_EXTRACTOR, 1, 3),
                backend("invidious", SourceKind.MIRROR, 2, 1));
        extractor.alwaysThrows(new BackendProtocolException("bad json", "yt-dlp"));
        mirror.alwaysReturns(List.of(track("song")));

        resolver(chain).resolve("song");

        assertThat(extractor.searchCalls()).isEqualTo(1);
        assertThat(attemptsOf("yt-dlp")).extracting(BackendAttemptEvent::outcome)
                .containsExactly(AttemptOutcome.PROTOCOL_ERROR);
        assertThat(pauses).isEmpty();
    }

    @Test
    void unexpectedAdapterFailureCountsAsUnavailable() {
        extractor.alwaysThrows(new IllegalStateException("adapter bug"));
        mirror.alwaysReturns(List.of(track("song")));

        assertThat(resolver(defaultChain()).resolve("song")).hasSize(1);

        assertThat(extractor.searchCalls()).isEqualTo(1);
        assertThat(attemptsOf("yt-dlp")).extracting(BackendAttemptEvent::outcome)
                .containsExactly(AttemptOutcome.UNAVAILABLE);
    }

    @Test
    void allDisabledInvokesNoAdapter() {
        List<BackendConfig> chain = new ArrayList<>(defaultChain());
        chain.forEach(c -> c.setEnabled(false));
        extractor.alwaysReturns(List.of(track("song")));

        assertThatThrownBy(() -> resolver(chain).resolve("song"))
                .isExactlyInstanceOf(NoResultsException.class)
                .satisfies(e -> assertThat(((NoResultsException) e).getAttemptedBackends()).isEmpty());

        assertThat(extractor.searchCalls() + mirror.searchCalls() + feed.searchCalls()).isZero();
        assertThat(publisher.eventsOf(ResolutionExhaustedEvent.class)).singleElement()
                .satisfies(e -> assertThat(e.allFailed()).isFalse());
    }

    @Test
    void everyBackendFailingYieldsAllBackendsFailed() {
        extractor.alwaysThrows(new BackendUnavailableException("binary missing", "yt-dlp"));
        mirror.alwaysThrows(new BackendProtocolException("html instead of json", "invidious"));
        feed.alwaysThrows(new BackendUnavailableException("503", "youtube-feed"));

        assertThatThrownBy(() -> resolver(defaultChain()).resolve("song"))
                .isInstanceOf(AllBackendsFailedException.class)
                .satisfies(e -> {
                    AllBackendsFailedException failed = (AllBackendsFailedException) e;
                    assertThat(failed.getAttemptedBackends()).containsExactly("yt-dlp", "invidious", "youtube-feed");
                    assertThat(failed.getLastFailureKind()).isEqualTo(BackendFailureKind.UNAVAILABLE);
                    assertThat(failed.getLastError().getBackendName()).isEqualTo("youtube-feed");
                });
        assertThat(publisher.eventsOf(ResolutionExhaustedEvent.class)).singleElement()
                .satisfies(e -> assertThat(e.allFailed()).isTrue());
    }

    @Test
    void emptyAnswerMakesExhaustionPlainNoResults() {
        extractor.alwaysThrows(new BackendUnavailableException("binary missing", "yt-dlp"));

        assertThatThrownBy(() -> resolver(defaultChain()).resolve("song"))
                .isExactlyInstanceOf(NoResultsException.class);
        assertThat(attemptsOf("invidious")).extracting(BackendAttemptEvent::outcome)
                .containsExactly(AttemptOutcome.EMPTY);
    }

    @Test
    void saturatedPoolSkipsBackendWithoutRunningItOnCallerThread() {
        Item hit = track("around the world");
        mirror.alwaysReturns(List.of(hit));
        AtomicInteger submissions = new AtomicInteger();
        Executor rejectsFirst = task -> {
            if (submissions.incrementAndGet() == 1) {
                throw new RejectedExecutionException("pool full");
            }
            task.run();
        };
        HierarchicalResolver resolver = resolver(new BackendRegistry(defaultChain()), rejectsFirst);

        List<Item> result = resolver.resolve("around the world");

        assertThat(result).containsExactly(hit);
        assertThat(extractor.searchCalls()).isZero();
        assertThat(attemptsOf("yt-dlp"))
                .extracting(BackendAttemptEvent::outcome)
                .containsExactly(AttemptOutcome.UNAVAILABLE);
    }

    @Test
    void servesRepeatedQueriesFromCache() {
        extractor.alwaysReturns(List.of(track("one more time")));
        HierarchicalResolver resolver = resolver(defaultChain());

        resolver.resolve("Daft Punk - One More Time!");
        List<Item> second = resolver.resolve("daft punk   one more time");

        assertThat(second).extracting(Item::title).containsExactly("one more time");
        assertThat(extractor.searchCalls()).isEqualTo(1);
    }

    @Test
    void searchesAgainWhenCachedResultsWereFetchedUnderSmallerLimit() {
        List<Item> catalogue = List.of(track("song a"), track("song b"), track("song c"));
        extractor.searchFallback(q -> {
            int limit = extractor.searchLimits.get(extractor.searchLimits.size() - 1);
            return catalogue.subList(0, Math.min(limit, catalogue.size()));
        });
        HierarchicalResolver resolver = resolver(defaultChain());

        assertThat(resolver.resolve("song", 1)).hasSize(1);
        assertThat(resolver.resolve("song", 5)).hasSize(3);
        assertThat(extractor.searchLimits).containsExactly(1, 5);

        // three results under limit 5 means the backend has no more to give
        assertThat(resolver.resolve("song", 4)).hasSize(3);
        assertThat(resolver.resolve("song", 2)).hasSize(2);
        assertThat(extractor.searchCalls()).isEqualTo(2);
    }

    @Test
    void triesCorrectedQueriesWhenChainIsEmpty() {
        Item hit = track("daft punk around the world");
        extractor.searchFallback(q -> q.equals("daft punk") ? List.of(hit) : List.of());
        HierarchicalResolver resolver = resolver(defaultChain());

        assertThat(resolver.resolve("daft punk around the world")).containsExactly(hit);
        assertThat(extractor.searchQueries).containsExactly("daft punk around the world", "daft punk");

        // The answer is remembered under the original query
        resolver.resolve("daft punk around the world");
        assertThat(extractor.searchCalls()).isEqualTo(2);
    }

    @Test
    void clampsLimit() {
        List<Item> five = List.of(track("a"), track("b"), track("c"), track("d"), track("e"));
        extractor.alwaysReturns(five);
        HierarchicalResolver resolver = resolver(defaultChain());

        assertThat(resolver.resolve("first", 2)).hasSize(2);
        assertThat(resolver.resolve("second", 0)).hasSize(1);
        resolver.resolve("third", 1000);

        assertThat(extractor.searchLimits).containsExactly(2, 1, properties.getMaxLimit());
    }

    @Test
    void rejectsBlankInput() {
        HierarchicalResolver resolver = resolver(defaultChain());
        assertThatThrownBy(() -> resolver.resolve("   ")).isInstanceOf(IllegalArgumentException.class);
        assertThatThrownBy(() -> resolver.resolve(null)).isInstanceOf(IllegalArgumentException.class);
    }

    @Test
    void resolvesClaimedUrlDirectlyAndCachesMetadata() {
        String url = "https://www.youtube.com/watch?v=dQw4w9WgXcQ";
        Item item = track("rick");
        mirror.claims = u -> u.contains("youtube.com");
        mirror.resolver = u -> Optional.of(item);
        HierarchicalResolver resolver = resolver(defaultChain());

        assertThat(resolver.resolve(url)).containsExactly(item);
        assertThat(resolver.resolve(url)).containsExactly(item);

        assertThat(mirror.resolvedUrls).containsExactly(url);
        assertThat(extractor.searchCalls() + mirror.searchCalls()).isZero();
        assertThat(attemptsOf("invidious")).extracting(BackendAttemptEvent::operation).containsExactly("resolve");
    }

    @Test
    void claimedUrlThatNoBackendResolvesIsNotSearched() {
        String url = "https://www.youtube.com/watch?v=dQw4w9WgXcQ";
        extractor.claims = u -> true;
        extractor.resolver = u -> {
            throw new BackendUnavailableException("video unavailable", "yt-dlp");
        };
        extractor.alwaysReturns(List.of(track("should not be searched")));

        assertThatThrownBy(() -> resolver(defaultChain()).resolve(url))
                .isInstanceOf(AllBackendsFailedException.class);
        assertThat(extractor.searchCalls()).isZero();
    }

    @Test
    void unclaimedUrlIsSearchedAsText() {
        String url = "https://example.org/some/page";
        feed.alwaysReturns(List.of(track("page")));

        assertThat(resolver(defaultChain()).resolve(url)).hasSize(1);
        assertThat(extractor.searchQueries).containsExactly(url);
    }

    @Test
    void disablingBackendAtRuntimeTakesEffectOnNextCall() {
        BackendRegistry registry = new BackendRegistry(defaultChain());
        extractor.alwaysReturns(List.of(track("from extractor")));
        mirror.alwaysReturns(List.of(track("from mirror")));
        HierarchicalResolver resolver = resolver(registry, new SyncExecutor());

        assertThat(resolver.resolve("first query")).extracting(Item::title).containsExactly("from extractor");

        registry.update("yt-dlp", new BackendRegistry.BackendUpdate(false, null, null, null));

        assertThat(resolver.resolve("second query")).extracting(Item::title).containsExactly("from mirror");
        assertThat(extractor.searchCalls()).isEqualTo(1);
    }

    @Test
    void enforcesPerBackendDeadline() {
        List<BackendConfig> chain = List.of(
                new BackendConfig("yt-dlp", SourceKind.PRIMARY_EXTRACTOR, 1, Duration.ofMillis(100), 1, true),
                backend("invidious", SourceKind.MIRROR, 2, 1));
        extractor.searchFallback(q -> {
            try {
                Thread.sleep(2_000);
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
            }
            return List.of(track("too late"));
        });
        mirror.alwaysReturns(List.of(track("on time")));
        ExecutorService pool = Executors.newCachedThreadPool();
        try {
            long start = System.nanoTime();
            List<Item> result = resolver(new BackendRegistry(chain), pool).resolve("song");
            long elapsedMs = (System.nanoTime() - start) / 1_000_000;

            assertThat(result).extracting(Item::title).containsExactly("on time");
            assertThat(elapsedMs).isLessThan(1_500);
            assertThat(attemptsOf("yt-dlp")).extracting(BackendAttemptEvent::outcome)
                    .containsExactly(AttemptOutcome.TIMEOUT);
        } finally {
            pool.shutdownNow();
        }
    }

    @Test
    void resolvesAndCachesStreamUrl() {
        Item item = track("song");
        mirror.claims = u -> true;
        mirror.streams = i -> Optional.of("https://cdn.example.com/audio.webm");
        HierarchicalResolver resolver = resolver(defaultChain());

        assertThat(resolver.resolveStreamUrl(item)).isEqualTo("https://cdn.example.com/audio.webm");
        assertThat(resolver.resolveStreamUrl(item)).isEqualTo("https://cdn.example.com/audio.webm");
        assertThat(mirror.streamRequests).hasSize(1);

        resolver.invalidateStreamUrl(item.canonicalUrl());
        resolver.resolveStreamUrl(item);
        assertThat(mirror.streamRequests).hasSize(2);
    }

    @Test
    void streamUrlFailsWhenNoProviderAnswers() {
        assertThatThrownBy(() -> resolver(defaultChain()).resolveStreamUrl(track("song")))
                .isInstanceOf(NoResultsException.class);
    }
}
