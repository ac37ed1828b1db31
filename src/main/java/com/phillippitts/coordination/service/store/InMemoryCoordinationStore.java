package com.phillippitts.coordination.service.store;

import com.phillippitts.coordination.domain.CoordinationEvent;
import com.phillippitts.coordination.domain.Insight;
import com.phillippitts.coordination.domain.Pattern;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Non-durable store for tests and ephemeral runs. Collections are copied on save and load.
 */
public class InMemoryCoordinationStore implements CoordinationStore {

    private volatile List<CoordinationEvent> events = List.of();
    private volatile Map<String, Pattern> patterns = Map.of();
    private volatile List<Insight> insights = List.of();

    @Override
    public List<CoordinationEvent> loadEvents() {
        return events;
    }

    @Override
    public void saveEvents(List<CoordinationEvent> events) {
        this.events = List.copyOf(events);
    }

    @Override
    public Map<String, Pattern> loadPatterns() {
        return new LinkedHashMap<>(patterns);
    }

    @Override
    public void savePatterns(Map<String, Pattern> patterns) {
        this.patterns = new LinkedHashMap<>(patterns);
    }

    @Override
    public List<Insight> loadInsights() {
        return insights;
    }

    @Override
    public void saveInsights(List<Insight> insights) {
        this.insights = List.copyOf(insights);
    }
}
