package com.phillippitts.openmusic.service.queue;

import com.phillippitts.openmusic.domain.Item;
import com.phillippitts.openmusic.domain.LoopMode;

import java.time.Duration;
import java.util.List;

/**
 * Consistent copy of a queue taken under its lock.
 *
 * @param sessionId playback context
 * @param current item playing now, or null
 * @param pending upcoming items in FIFO order
 * @param history recently played items, oldest first
 * @param failed quarantined items
 * @param loopMode loop setting
 * @param shuffle whether shuffle is on
 * @param recoveryMode whether recovery mode is active
 * @param totalDuration known playing time of current and pending items
 */
public record QueueSnapshot(
        String sessionId,
        Item current,
        List<Item> pending,
        List<Item> history,
        List<Item> failed,
        LoopMode loopMode,
        boolean shuffle,
        boolean recoveryMode,
        Duration totalDuration
) {
    public QueueSnapshot {
        pending = List.copyOf(pending);
        history = List.copyOf(history);
        failed = List.copyOf(failed);
    }

    public int size() {
        return pending.size();
    }
}
