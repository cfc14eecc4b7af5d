package com.phillippitts.openmusic.service.queue;

import com.phillippitts.openmusic.domain.Item;
import com.phillippitts.openmusic.domain.LoopMode;

import java.time.Instant;
import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Deque;
import java.util.HashMap;
import java.util.List;
import java.util.Map;

/**
 * Mutable state of one queue. Owned by exactly one {@link ResilientQueue}, which only touches
 * it while holding its lock; nothing here is thread-safe on its own.
 *
 * <p>Invariant: {@code current} is never also an element of {@code pending}.
 */
final class QueueState {

    final List<Item> pending = new ArrayList<>();
    Item current;
    final Deque<Item> history = new ArrayDeque<>();
    private final int historySize;
    LoopMode loopMode = LoopMode.OFF;
    boolean shuffle;

    /** Retry counter per canonical URL; absent means zero. */
    final Map<String, Integer> failureCounts = new HashMap<>();
    /** Quarantined items waiting for a recovery round. */
    final List<Item> failedItems = new ArrayList<>();
    /** Recovery rounds per canonical URL, feeding the cooldown policy. */
    final Map<String, Integer> recoveryRounds = new HashMap<>();

    final RecoveryState recovery = new RecoveryState();

    QueueState(int historySize) {
        this.historySize = historySize;
    }

    int failureCount(String url) {
        return failureCounts.getOrDefault(url, 0);
    }

    int recoveryRounds(String url) {
        return recoveryRounds.getOrDefault(url, 0);
    }

    /** Appends to history, dropping the oldest entries beyond the configured size. */
    void addToHistory(Item item) {
        history.addLast(item);
        while (history.size() > historySize) {
            history.removeFirst();
        }
    }

    /**
     * Failure streak shared by all items of the queue.
     */
    static final class RecoveryState {
        int consecutiveFailures;
        Instant lastFailureTime;
        boolean active;

        void reset() {
            consecutiveFailures = 0;
            lastFailureTime = null;
            active = false;
        }
    }
}
