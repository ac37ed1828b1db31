package com.phillippitts.coordination.domain;

import com.phillippitts.coordination.exception.InvalidWorkItemException;

import java.util.List;

/**
 * A single unit of requested work. Immutable once submitted.
 *
 * @param kind identifier of the work type; other items reference it in {@code dependencies}
 * @param description human-readable summary
 * @param payload opaque content handed to the external executor
 * @param priority execution priority, {@link Priority#MEDIUM} when absent
 * @param domain knowledge domain the item belongs to, {@code "general"} when absent
 * @param estimatedDuration expected run time in seconds
 * @param dependencies kinds this item must not co-execute with
 */
public record WorkItem(
        String kind,
        String description,
        String payload,
        Priority priority,
        String domain,
        double estimatedDuration,
        List<String> dependencies
) {
    public static final String DEFAULT_DOMAIN = "general";

    public WorkItem {
        if (kind == null || kind.isBlank()) {
            throw new InvalidWorkItemException("Work item kind must not be blank");
        }
        if (Double.isNaN(estimatedDuration) || estimatedDuration < 0) {
            throw new InvalidWorkItemException(
                    "Estimated duration must be >= 0 for item " + kind + " but was " + estimatedDuration);
        }
        description = description == null ? "" : description;
        payload = payload == null ? "" : payload;
        priority = priority == null ? Priority.MEDIUM : priority;
        domain = domain == null || domain.isBlank() ? DEFAULT_DOMAIN : domain;
        dependencies = dependencies == null ? List.of() : List.copyOf(dependencies);
    }

    /**
     * Convenience factory for items without description or payload.
     */
    public static WorkItem of(String kind, Priority priority, String domain,
                              double estimatedDuration, String... dependencies) {
        return new WorkItem(kind, "", "", priority, domain, estimatedDuration, List.of(dependencies));
    }

    public boolean dependsOn(String otherKind) {
        return dependencies.contains(otherKind);
    }
}
