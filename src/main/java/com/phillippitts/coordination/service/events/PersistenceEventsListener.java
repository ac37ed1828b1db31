package com.phillippitts.coordination.service.events;

import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import org.springframework.context.event.EventListener;
import org.springframework.stereotype.Component;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Centralized handler for store and lifecycle anomalies. Throttled per key to avoid log spam
 * when the data directory stays unwritable.
 */
@Component
class PersistenceEventsListener {
    private static final Logger LOG = LogManager.getLogger(PersistenceEventsListener.class);

    private static final Duration THROTTLE = Duration.ofMinutes(1);

    private final Map<String, Instant> lastLog = new ConcurrentHashMap<>();
    private final Clock clock;

    PersistenceEventsListener(Clock clock) {
        this.clock = clock;
    }

    @EventListener
    void onPersistenceFailure(PersistenceFailureEvent e) {
        if (shouldLog("persistence-" + e.collection())) {
            LOG.error("Failed to persist {}: {}. In-memory state is kept; check coordination.learning.data-dir.",
                    e.collection(), e.message());
        }
    }

    @EventListener
    void onOrphanCompletion(OrphanCompletionEvent e) {
        if (shouldLog("orphan-" + e.type())) {
            LOG.warn("Received {} without a matching start (id={}). Callers must report start first.",
                    e.type(), e.coordinationId());
        }
    }

    // Package-private for tests
    boolean shouldLog(String key) {
        Instant now = clock.instant();
        Instant prev = lastLog.get(key);
        if (prev == null || Duration.between(prev, now).compareTo(THROTTLE) > 0) {
            lastLog.put(key, now);
            return true;
        }
        return false;
    }
}
