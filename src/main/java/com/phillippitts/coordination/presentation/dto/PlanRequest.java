package com.phillippitts.coordination.presentation.dto;

import com.phillippitts.coordination.domain.WorkItem;
import jakarta.validation.Valid;
import jakarta.validation.constraints.NotNull;

import java.util.List;

/**
 * @param allowDegraded return a degraded plan instead of rejecting on capacity or budget
 */
public record PlanRequest(
        @NotNull(message = "items must be provided") List<@Valid WorkItemRequest> items,
        boolean allowDegraded
) {
    public List<WorkItem> toWorkItems() {
        return items.stream().map(WorkItemRequest::toWorkItem).toList();
    }
}
