package com.phillippitts.coordination.presentation.dto;

import com.phillippitts.coordination.domain.Priority;
import com.phillippitts.coordination.domain.WorkItem;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.PositiveOrZero;

import java.util.List;

/**
 * JSON form of a {@link WorkItem}. Omitted fields take the work item defaults.
 */
public record WorkItemRequest(
        @NotBlank(message = "kind must not be blank") String kind,
        String description,
        String payload,
        Priority priority,
        String domain,
        @PositiveOrZero Double estimatedDuration,
        List<String> dependencies
) {
    public WorkItem toWorkItem() {
        return new WorkItem(kind, description, payload, priority, domain,
                estimatedDuration == null ? 0.0 : estimatedDuration, dependencies);
    }
}
