package com.phillippitts.coordination.domain;

import com.phillippitts.coordination.exception.InvalidWorkItemException;
import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class WorkItemTest {

    @Test
    void appliesDefaults() {
        WorkItem item = new WorkItem("lint", null, null, null, " ", 0.0, null);

        assertThat(item.priority()).isEqualTo(Priority.MEDIUM);
        assertThat(item.domain()).isEqualTo(WorkItem.DEFAULT_DOMAIN);
        assertThat(item.description()).isEmpty();
        assertThat(item.payload()).isEmpty();
        assertThat(item.dependencies()).isEmpty();
    }

    @Test
    void rejectsBlankKind() {
        assertThatThrownBy(() -> WorkItem.of(" ", Priority.LOW, "x", 1.0))
                .isInstanceOf(InvalidWorkItemException.class)
                .hasMessageContaining("kind");
    }

    @Test
    void rejectsNegativeOrNaNDuration() {
        assertThatThrownBy(() -> WorkItem.of("a", Priority.LOW, "x", -1.0))
                .isInstanceOf(InvalidWorkItemException.class);
        assertThatThrownBy(() -> WorkItem.of("a", Priority.LOW, "x", Double.NaN))
                .isInstanceOf(InvalidWorkItemException.class);
    }

    @Test
    void reportsDependencies() {
        WorkItem item = WorkItem.of("deploy", Priority.HIGH, "ops", 1.0, "build");

        assertThat(item.dependsOn("build")).isTrue();
        assertThat(item.dependsOn("test")).isFalse();
    }
}
