package com.phillippitts.openmusic.service.queue;

import com.phillippitts.openmusic.config.properties.QueueProperties;
import jakarta.annotation.PreDestroy;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import org.springframework.context.ApplicationEventPublisher;
import org.springframework.stereotype.Component;

import java.time.Clock;
import java.util.Optional;
import java.util.Set;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ConcurrentMap;

/**
 * Owns the queue of every active session. Queues are created on first use and live until
 * removed or until the application context shuts down.
 */
@Component
public class QueueRegistry {

    private static final Logger LOG = LogManager.getLogger(QueueRegistry.class);

    private final ConcurrentMap<String, ResilientQueue> queues = new ConcurrentHashMap<>();
    private final QueueProperties properties;
    private final Clock clock;
    private final ApplicationEventPublisher publisher;

    public QueueRegistry(QueueProperties properties, Clock clock, ApplicationEventPublisher publisher) {
        this.properties = properties;
        this.clock = clock;
        this.publisher = publisher;
    }

    /** Returns the session's queue, creating it if needed. */
    public ResilientQueue forSession(String sessionId) {
        if (sessionId == null || sessionId.isBlank()) {
            throw new IllegalArgumentException("sessionId must not be blank");
        }
        return queues.computeIfAbsent(sessionId, id -> {
            LOG.debug("Creating queue for session {}", id);
            return new ResilientQueue(id, properties, clock, publisher);
        });
    }

    public Optional<ResilientQueue> find(String sessionId) {
        return Optional.ofNullable(queues.get(sessionId));
    }

    /** @return true if the session had a queue */
    public boolean remove(String sessionId) {
        return queues.remove(sessionId) != null;
    }

    public Set<String> sessions() {
        return Set.copyOf(queues.keySet());
    }

    @PreDestroy
    void shutdown() {
        LOG.info("Dropping {} session queues", queues.size());
        queues.clear();
    }
}
