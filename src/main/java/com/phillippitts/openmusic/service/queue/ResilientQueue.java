package com.phillippitts.openmusic.service.queue;

import com.phillippitts.openmusic.config.properties.QueueProperties;
import com.phillippitts.openmusic.domain.Item;
import com.phillippitts.openmusic.domain.LoopMode;
import com.phillippitts.openmusic.exception.QuarantinedItemException;
import com.phillippitts.openmusic.exception.QueueFullException;
import com.phillippitts.openmusic.service.queue.event.ItemQuarantinedEvent;
import com.phillippitts.openmusic.service.queue.event.RecoveryModeChangedEvent;
import com.phillippitts.openmusic.service.queue.event.RecoveryReadmissionEvent;
import com.phillippitts.openmusic.util.LogSanitizer;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import org.springframework.context.ApplicationEventPublisher;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.HashSet;
import java.util.Iterator;
import java.util.List;
import java.util.Objects;
import java.util.Optional;
import java.util.Random;
import java.util.Set;
import java.util.concurrent.locks.Lock;
import java.util.concurrent.locks.ReentrantLock;
import java.util.function.Function;

/**
 * Playback queue of one session that keeps going when individual items fail.
 *
 * <p>The playback collaborator reports every attempt through {@link #reportSuccess} or
 * {@link #reportFailure}. An item whose retry counter reaches {@code queue.max-retries} is
 * quarantined: it is moved to the failed list and never selected again by {@link #dequeue()}
 * until a recovery round re-admits it with a fresh counter. Recovery rounds happen when
 * nothing else is playable and the cooldown since the last failure has passed; each round
 * re-admits at most {@code queue.recovery-batch-size} items.
 *
 * <p><b>Thread Safety:</b> every operation is one transition of {@link QueueState} under a
 * single {@link ReentrantLock}, so two dequeues can never select the same item. Events are
 * published after the lock is released.
 */
public final class ResilientQueue {

    private static final Logger LOG = LogManager.getLogger(ResilientQueue.class);

    private final String sessionId;
    private final QueueProperties properties;
    private final Clock clock;
    private final ApplicationEventPublisher publisher;
    private final Random random;
    private final RecoveryCooldownPolicy cooldownPolicy;

    private final Lock lock = new ReentrantLock();
    private final QueueState state;

    public ResilientQueue(String sessionId, QueueProperties properties, Clock clock,
                          ApplicationEventPublisher publisher) {
        this(sessionId, properties, clock, publisher, new Random(), RecoveryCooldownPolicy.from(properties));
    }

    ResilientQueue(String sessionId, QueueProperties properties, Clock clock,
                   ApplicationEventPublisher publisher, Random random, RecoveryCooldownPolicy cooldownPolicy) {
        this.sessionId = Objects.requireNonNull(sessionId, "sessionId");
        this.properties = Objects.requireNonNull(properties, "properties");
        this.clock = Objects.requireNonNull(clock, "clock");
        this.publisher = Objects.requireNonNull(publisher, "publisher");
        this.random = Objects.requireNonNull(random, "random");
        this.cooldownPolicy = Objects.requireNonNull(cooldownPolicy, "cooldownPolicy");
        this.state = new QueueState(properties.getHistorySize());
    }

    public String sessionId() {
        return sessionId;
    }

    /**
     * Appends an item to the pending list.
     *
     * <p>A quarantined item is accepted only once its cooldown has passed; it then starts over
     * with a zero retry counter and leaves the failed list.
     *
     * @return 1-based position of the item in the pending list
     * @throws QueueFullException if the pending list is at {@code queue.max-size}
     * @throws QuarantinedItemException if the item is quarantined and still cooling down
     */
    public int enqueue(Item item) {
        Objects.requireNonNull(item, "item");
        return transition(events -> {
            if (state.pending.size() >= properties.getMaxSize()) {
                throw new QueueFullException(properties.getMaxSize());
            }
            String url = item.canonicalUrl();
            int failures = state.failureCount(url);
            if (failures >= properties.getMaxRetries()) {
                if (!cooldownElapsed(url, clock.instant())) {
                    throw new QuarantinedItemException(url, failures);
                }
                state.failureCounts.remove(url);
                state.recoveryRounds.merge(url, 1, Integer::sum);
                state.failedItems.removeIf(failed -> failed.canonicalUrl().equals(url));
                LOG.info("Re-admitting quarantined item on request: {}", LogSanitizer.redactUrl(url));
            }
            state.pending.add(item);
            return state.pending.size();
        });
    }

    /**
     * Advances to the next playable item.
     *
     * <p>The previous current item goes to history (or to the failed list when quarantined).
     * With {@link LoopMode#TRACK} it is offered again while below the retry limit; with
     * {@link LoopMode#QUEUE} it is also appended to the pending tail. Candidates are taken from
     * the head, or at random when shuffle is on; quarantined candidates are moved to the
     * failed list and the search goes on, at most once per pending item.
     *
     * @return the new current item, or empty when nothing is playable now
     */
    public Optional<Item> dequeue() {
        return transition(events -> {
            Instant now = clock.instant();
            Item previous = state.current;
            state.current = null;
            if (previous != null) {
                if (isQuarantined(previous.canonicalUrl())) {
                    state.failedItems.add(previous);
                } else if (state.loopMode == LoopMode.TRACK) {
                    state.current = previous;
                    return Optional.of(previous);
                } else {
                    state.addToHistory(previous);
                    if (state.loopMode == LoopMode.QUEUE) {
                        state.pending.add(previous);
                    }
                }
            }

            Optional<Item> next = selectEligible(events, now);
            if (next.isPresent() || state.failedItems.isEmpty()) {
                return next;
            }
            return recover(events, now);
        });
    }

    /**
     * Records a failed playback attempt of {@code url}.
     *
     * <p>Increments the URL's retry counter and the consecutive failure streak. At
     * {@code queue.consecutive-failure-threshold} consecutive failures recovery mode turns on.
     * When the counter reaches {@code queue.max-retries} and the URL is the current item, the
     * item is moved to the failed list.
     */
    public FailureReport reportFailure(String url, String reason) {
        Objects.requireNonNull(url, "url");
        return transition(events -> {
            Instant now = clock.instant();
            int count = state.failureCounts.merge(url, 1, Integer::sum);
            QueueState.RecoveryState recovery = state.recovery;
            recovery.consecutiveFailures++;
            recovery.lastFailureTime = now;
            LOG.warn("Playback failed (attempt {}) for {}: {}", count, LogSanitizer.redactUrl(url),
                    LogSanitizer.truncate(reason, 200));

            if (recovery.consecutiveFailures >= properties.getConsecutiveFailureThreshold() && !recovery.active) {
                recovery.active = true;
                events.add(new RecoveryModeChangedEvent(sessionId, true, recovery.consecutiveFailures, now));
            }

            boolean quarantined = count >= properties.getMaxRetries();
            if (quarantined && state.current != null && url.equals(state.current.canonicalUrl())) {
                Item item = state.current;
                state.current = null;
                state.failedItems.add(item);
                events.add(new ItemQuarantinedEvent(sessionId, url, item.title(), count, now));
            }
            return new FailureReport(url, count, quarantined, recovery.active);
        });
    }

    /**
     * Records a successful playback of {@code url}: forgets its retry counter and recovery
     * rounds, ends the failure streak and leaves recovery mode. Idempotent.
     */
    public void reportSuccess(String url) {
        Objects.requireNonNull(url, "url");
        transition(events -> {
            state.failureCounts.remove(url);
            state.recoveryRounds.remove(url);
            QueueState.RecoveryState recovery = state.recovery;
            recovery.consecutiveFailures = 0;
            if (recovery.active) {
                recovery.active = false;
                events.add(new RecoveryModeChangedEvent(sessionId, false, 0, clock.instant()));
            }
            return null;
        });
    }

    /**
     * Puts the current item back at the head of the pending list so the next dequeue retries
     * it, provided it is still the item at {@code url}. Used after a failure below the retry
     * limit; the check and the move happen in one transition, so an item selected by a dequeue
     * racing the failure report is left playing.
     *
     * @return false when there is no current item or it has a different URL
     */
    public boolean requeueCurrentIf(String url) {
        Objects.requireNonNull(url, "url");
        return transition(events -> {
            if (state.current == null || !state.current.canonicalUrl().equals(url)) {
                return false;
            }
            state.pending.add(0, state.current);
            state.current = null;
            return true;
        });
    }

    /**
     * Moves up to {@code count} items from the head of the pending list to history.
     *
     * @return number of items skipped
     */
    public int skip(int count) {
        if (count < 0) {
            throw new IllegalArgumentException("count must be >= 0: " + count);
        }
        return transition(events -> {
            int skipped = Math.min(count, state.pending.size());
            for (int i = 0; i < skipped; i++) {
                state.addToHistory(state.pending.remove(0));
            }
            return skipped;
        });
    }

    /**
     * Empties the pending and failed lists and forgets all failure bookkeeping. The current
     * item and history are kept.
     *
     * @return number of pending items removed
     */
    public int clear() {
        return transition(events -> {
            int cleared = state.pending.size();
            state.pending.clear();
            state.failedItems.clear();
            state.failureCounts.clear();
            state.recoveryRounds.clear();
            if (state.recovery.active) {
                events.add(new RecoveryModeChangedEvent(sessionId, false, 0, clock.instant()));
            }
            state.recovery.reset();
            LOG.info("Queue {} cleared: {} items removed", sessionId, cleared);
            return cleared;
        });
    }

    /**
     * Removes pending items whose URL already appears earlier in the pending list.
     *
     * @return number of items removed
     */
    public int removeDuplicates() {
        return transition(events -> {
            Set<String> seen = new HashSet<>();
            int before = state.pending.size();
            state.pending.removeIf(item -> !seen.add(item.canonicalUrl()));
            return before - state.pending.size();
        });
    }

    public void setLoopMode(LoopMode mode) {
        Objects.requireNonNull(mode, "mode");
        transition(events -> {
            state.loopMode = mode;
            return null;
        });
    }

    /** @return the new shuffle flag */
    public boolean toggleShuffle() {
        return transition(events -> {
            state.shuffle = !state.shuffle;
            return state.shuffle;
        });
    }

    public Optional<Item> current() {
        return transition(events -> Optional.ofNullable(state.current));
    }

    public int size() {
        return transition(events -> state.pending.size());
    }

    public boolean isEmpty() {
        return size() == 0;
    }

    public int failureCount(String url) {
        return transition(events -> state.failureCount(url));
    }

    public boolean isRecoveryModeActive() {
        return transition(events -> state.recovery.active);
    }

    public QueueSnapshot snapshot() {
        return transition(events -> {
            Duration total = Duration.ZERO;
            if (state.current != null && state.current.hasDuration()) {
                total = total.plus(state.current.duration());
            }
            for (Item item : state.pending) {
                if (item.hasDuration()) {
                    total = total.plus(item.duration());
                }
            }
            return new QueueSnapshot(sessionId, state.current, state.pending, new ArrayList<>(state.history),
                    state.failedItems, state.loopMode, state.shuffle, state.recovery.active, total);
        });
    }

    public QueueStats stats() {
        return transition(events -> {
            int total = state.failureCounts.values().stream().mapToInt(Integer::intValue).sum();
            return new QueueStats(state.pending.size(), state.failedItems.size(), state.failureCounts.size(),
                    total, state.recovery.consecutiveFailures, state.recovery.active);
        });
    }

    private Optional<Item> selectEligible(List<Object> events, Instant now) {
        int candidates = state.pending.size();
        for (int i = 0; i < candidates && !state.pending.isEmpty(); i++) {
            int index = state.shuffle ? random.nextInt(state.pending.size()) : 0;
            Item candidate = state.pending.remove(index);
            String url = candidate.canonicalUrl();
            if (isQuarantined(url)) {
                state.failedItems.add(candidate);
                LOG.warn("Skipping quarantined item: {}", LogSanitizer.truncate(candidate.title(), 80));
                events.add(new ItemQuarantinedEvent(sessionId, url, candidate.title(), state.failureCount(url), now));
                continue;
            }
            state.current = candidate;
            return Optional.of(candidate);
        }
        return Optional.empty();
    }

    /**
     * Nothing playable is left but the failed list is not empty: re-admit up to one batch of
     * items whose cooldown has passed, then try selection once more.
     */
    private Optional<Item> recover(List<Object> events, Instant now) {
        QueueState.RecoveryState recovery = state.recovery;
        if (!recovery.active) {
            recovery.active = true;
            events.add(new RecoveryModeChangedEvent(sessionId, true, recovery.consecutiveFailures, now));
            LOG.warn("Queue {} has no playable item left, entering recovery mode", sessionId);
        }

        List<String> readmitted = new ArrayList<>();
        Iterator<Item> it = state.failedItems.iterator();
        while (it.hasNext() && readmitted.size() < properties.getRecoveryBatchSize()) {
            Item item = it.next();
            String url = item.canonicalUrl();
            if (!cooldownElapsed(url, now)) {
                continue;
            }
            it.remove();
            state.failureCounts.remove(url);
            state.recoveryRounds.merge(url, 1, Integer::sum);
            state.pending.add(item);
            readmitted.add(url);
        }
        if (readmitted.isEmpty()) {
            LOG.debug("Queue {}: {} failed items still cooling down", sessionId, state.failedItems.size());
            return Optional.empty();
        }
        LOG.info("Queue {}: re-admitted {} failed items for another attempt", sessionId, readmitted.size());
        events.add(new RecoveryReadmissionEvent(sessionId, readmitted, now));
        return selectEligible(events, now);
    }

    private boolean isQuarantined(String url) {
        return state.failureCount(url) >= properties.getMaxRetries();
    }

    private boolean cooldownElapsed(String url, Instant now) {
        Instant lastFailure = state.recovery.lastFailureTime;
        if (lastFailure == null) {
            return true;
        }
        Duration cooldown = cooldownPolicy.cooldownFor(state.recoveryRounds(url));
        return Duration.between(lastFailure, now).compareTo(cooldown) >= 0;
    }

    /**
     * Runs one state transition under the lock and publishes the events it collected after
     * releasing it.
     */
    private <T> T transition(Function<List<Object>, T> body) {
        List<Object> events = new ArrayList<>(2);
        T result;
        lock.lock();
        try {
            result = body.apply(events);
        } finally {
            lock.unlock();
        }
        events.forEach(publisher::publishEvent);
        return result;
    }
}
