package com.phillippitts.coordination.domain;

import java.util.List;

/**
 * Ordered batch plan handed to the external executor. Immutable.
 *
 * @param batches batches in execution order; items within a batch may run in parallel
 * @param strategy strategy assigned to the plan
 * @param estimatedTotalTime estimated wall time in seconds
 * @param degraded whether the plan runs outside the normal operating envelope
 */
public record CoordinationPlan(
        List<List<WorkItem>> batches,
        Strategy strategy,
        double estimatedTotalTime,
        boolean degraded
) {
    public CoordinationPlan {
        batches = batches == null
                ? List.of(List.of())
                : batches.stream().map(List::copyOf).toList();
    }

    /**
     * Plan for an empty request: one empty batch with zero duration.
     */
    public static CoordinationPlan empty() {
        return new CoordinationPlan(List.of(List.of()), Strategy.DIRECT, 0.0, false);
    }

    public int batchCount() {
        return batches.size();
    }

    public int itemCount() {
        return batches.stream().mapToInt(List::size).sum();
    }

    public List<String> domains() {
        return batches.stream()
                .flatMap(List::stream)
                .map(WorkItem::domain)
                .distinct()
                .sorted()
                .toList();
    }

    public List<String> itemKinds() {
        return batches.stream()
                .flatMap(List::stream)
                .map(WorkItem::kind)
                .toList();
    }
}
