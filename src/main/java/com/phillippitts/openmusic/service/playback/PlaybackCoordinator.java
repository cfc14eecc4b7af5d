package com.phillippitts.openmusic.service.playback;

import com.phillippitts.openmusic.domain.Item;
import com.phillippitts.openmusic.exception.NoResultsException;
import com.phillippitts.openmusic.exception.QuarantinedItemException;
import com.phillippitts.openmusic.exception.QueueFullException;
import com.phillippitts.openmusic.service.metrics.QueueMetrics;
import com.phillippitts.openmusic.service.queue.FailureReport;
import com.phillippitts.openmusic.service.queue.QueueRegistry;
import com.phillippitts.openmusic.service.queue.ResilientQueue;
import com.phillippitts.openmusic.service.resolver.HierarchicalResolver;
import com.phillippitts.openmusic.util.LogSanitizer;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import org.springframework.stereotype.Service;

import java.util.List;
import java.util.Objects;
import java.util.Optional;

/**
 * Entry point for the command layer: glues resolution, per-session queues and playback
 * feedback together.
 *
 * <p>On a reported failure below the retry limit the cached stream URL of the item is dropped
 * and the item is put back at the head of its queue, so the next {@link #next(String)} retries
 * it with a freshly resolved stream. At the limit the queue quarantines it and playback moves on.
 */
@Service
public class PlaybackCoordinator {

    private static final Logger LOG = LogManager.getLogger(PlaybackCoordinator.class);

    private final HierarchicalResolver resolver;
    private final QueueRegistry queues;
    private final QueueMetrics metrics;

    public PlaybackCoordinator(HierarchicalResolver resolver, QueueRegistry queues, QueueMetrics metrics) {
        this.resolver = Objects.requireNonNull(resolver, "resolver");
        this.queues = Objects.requireNonNull(queues, "queues");
        this.metrics = Objects.requireNonNull(metrics, "metrics");
    }

    /**
     * Resolves {@code text} and enqueues the best match for {@code requester}.
     *
     * @throws NoResultsException if nothing was found
     * @throws QueueFullException if the session's queue is full
     * @throws QuarantinedItemException if the best match is quarantined and cooling down
     */
    public Item request(String sessionId, String text, String requester) {
        List<Item> results = resolver.resolve(text, 1);
        Item item = results.get(0).withRequestedBy(requester);
        int position = queues.forSession(sessionId).enqueue(item);
        LOG.info("Session {}: queued '{}' at position {}", sessionId,
                LogSanitizer.truncate(item.title(), 80), position);
        return item;
    }

    /** Advances the session's queue; empty when nothing is playable now. */
    public Optional<Item> next(String sessionId) {
        return queues.forSession(sessionId).dequeue();
    }

    /**
     * Playable stream URL of {@code item}.
     *
     * @throws NoResultsException if no backend could produce one
     */
    public String streamUrl(Item item) {
        return resolver.resolveStreamUrl(item);
    }

    public void reportSuccess(String sessionId, String url) {
        queues.forSession(sessionId).reportSuccess(url);
        metrics.recordPlayback(true);
    }

    public FailureReport reportFailure(String sessionId, String url, String reason) {
        ResilientQueue queue = queues.forSession(sessionId);
        FailureReport report = queue.reportFailure(url, reason);
        metrics.recordPlayback(false);
        resolver.invalidateStreamUrl(url);
        if (!report.quarantined()) {
            queue.requeueCurrentIf(url);
        } else {
            LOG.info("Session {}: {} quarantined after {} failures", sessionId,
                    LogSanitizer.redactUrl(url), report.failureCount());
        }
        return report;
    }
}
