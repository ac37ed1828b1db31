package com.phillippitts.coordination.service.learning;

import com.phillippitts.coordination.domain.CoordinationEvent;
import com.phillippitts.coordination.domain.CoordinationEventType;
import com.phillippitts.coordination.exception.InvalidWorkItemException;
import com.phillippitts.coordination.service.store.CoordinationStore;
import com.phillippitts.coordination.util.LogSanitizer;
import com.phillippitts.coordination.util.TimeUtils;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

import java.time.Clock;
import java.time.Instant;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Objects;

/**
 * Append-only log of coordination lifecycle events.
 *
 * <p>Per coordination id: {@code START → COMPLETE | ERROR | TIMEOUT}. A terminal event is
 * paired with the most recent START carrying the same id, unless a terminal event has already
 * closed that START. Without an open START it is recorded as an orphan with no duration.
 *
 * <p>Not thread-safe; the owning engine serializes access. Persistence is explicit through
 * {@link #persist()} so the caller decides how write failures are surfaced.
 */
public class CoordinationEventLog {

    private static final Logger LOG = LogManager.getLogger(CoordinationEventLog.class);

    private final CoordinationStore store;
    private final Clock clock;
    private final int maxEvents;
    private final List<CoordinationEvent> events;

    /**
     * @param maxEvents keep only the newest N events; 0 keeps everything
     */
    public CoordinationEventLog(CoordinationStore store, Clock clock, int maxEvents) {
        this.store = Objects.requireNonNull(store, "store");
        this.clock = Objects.requireNonNull(clock, "clock");
        this.maxEvents = Math.max(0, maxEvents);
        this.events = new ArrayList<>(store.loadEvents());
        LOG.info("Event log loaded with {} events", events.size());
    }

    public CoordinationEvent recordStart(String id, int itemCount, List<String> domains,
                                         String strategy, List<String> itemKinds) {
        requireId(id);
        CoordinationEvent start = CoordinationEvent.start(id, clock.instant(), itemCount, domains,
                strategy, itemKinds);
        append(start);
        return start;
    }

    /**
     * Records a terminal event for {@code id}.
     *
     * @param type COMPLETE, ERROR or TIMEOUT
     * @return the recorded event and its START, if any
     */
    public TerminalRecord recordTerminal(String id, CoordinationEventType type, boolean success,
                                         String errorMessage) {
        requireId(id);
        if (!type.isTerminal()) {
            throw new IllegalArgumentException("Not a terminal event type: " + type);
        }
        Instant now = clock.instant();
        CoordinationEvent start = findOpenStart(id);
        Double duration = start == null ? null : TimeUtils.secondsBetween(start.timestamp(), now);
        CoordinationEvent terminal = CoordinationEvent.terminal(id, type, now, start, duration,
                success, errorMessage);
        append(terminal);
        if (start == null) {
            LOG.warn("Terminal event {} for id={} has no open start; recorded without duration", type, id);
        } else if (!success) {
            LOG.info("Coordination failed: type={}, error={}", type, LogSanitizer.singleLine(errorMessage, 200));
        }
        return new TerminalRecord(terminal, start);
    }

    /**
     * Writes the full event list to the store.
     *
     * @throws com.phillippitts.coordination.exception.PersistenceException on write failure
     */
    public void persist() {
        store.saveEvents(List.copyOf(events));
    }

    public List<CoordinationEvent> events() {
        return Collections.unmodifiableList(new ArrayList<>(events));
    }

    public int size() {
        return events.size();
    }

    /**
     * Latest START for {@code id} not yet closed by a terminal event, or {@code null}.
     */
    CoordinationEvent findOpenStart(String id) {
        for (int i = events.size() - 1; i >= 0; i--) {
            CoordinationEvent e = events.get(i);
            if (!e.id().equals(id)) {
                continue;
            }
            return e.type() == CoordinationEventType.START ? e : null;
        }
        return null;
    }

    private void append(CoordinationEvent event) {
        events.add(event);
        if (maxEvents > 0 && events.size() > maxEvents) {
            events.subList(0, events.size() - maxEvents).clear();
        }
    }

    private static void requireId(String id) {
        if (id == null || id.isBlank()) {
            throw new InvalidWorkItemException("Coordination id must not be blank");
        }
    }

    /**
     * A terminal event and the START it closes.
     *
     * @param start {@code null} for orphan completions
     */
    public record TerminalRecord(CoordinationEvent event, CoordinationEvent start) {

        public boolean isOrphan() {
            return start == null;
        }

        public boolean isLearnable() {
            return start != null && event.durationSeconds() != null;
        }
    }
}
