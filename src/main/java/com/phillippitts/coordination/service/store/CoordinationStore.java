package com.phillippitts.coordination.service.store;

import com.phillippitts.coordination.domain.CoordinationEvent;
import com.phillippitts.coordination.domain.Insight;
import com.phillippitts.coordination.domain.Pattern;
import com.phillippitts.coordination.exception.PersistenceException;

import java.util.List;
import java.util.Map;

/**
 * Durable storage for the three engine collections.
 *
 * <p>Each save replaces the whole collection. Loads never fail: an absent or unreadable
 * collection loads as empty.
 */
public interface CoordinationStore {

    String EVENTS = "events";
    String PATTERNS = "patterns";
    String INSIGHTS = "insights";

    List<CoordinationEvent> loadEvents();

    /**
     * @throws PersistenceException if the collection cannot be written
     */
    void saveEvents(List<CoordinationEvent> events);

    /**
     * @return patterns keyed by their canonical key
     */
    Map<String, Pattern> loadPatterns();

    /**
     * @throws PersistenceException if the collection cannot be written
     */
    void savePatterns(Map<String, Pattern> patterns);

    List<Insight> loadInsights();

    /**
     * @throws PersistenceException if the collection cannot be written
     */
    void saveInsights(List<Insight> insights);
}
