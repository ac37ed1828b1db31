package com.phillippitts.coordination.config.properties;

import jakarta.validation.constraints.Positive;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.boot.context.properties.bind.ConstructorBinding;
import org.springframework.validation.annotation.Validated;

/**
 * Thresholds for strategy selection. Counts are inclusive upper bounds.
 */
@Validated
@ConfigurationProperties(prefix = "coordination.strategy")
public class StrategyProperties {

    @Positive
    private final int directMaxItems;

    @Positive
    private final int parallelMaxItems;

    @Positive
    private final int strategicMaxItems;

    /**
     * Distinct domain count at which a request escalates to at least STRATEGIC.
     */
    @Positive
    private final int domainEscalationThreshold;

    @ConstructorBinding
    public StrategyProperties(Integer directMaxItems,
                              Integer parallelMaxItems,
                              Integer strategicMaxItems,
                              Integer domainEscalationThreshold) {
        this.directMaxItems = directMaxItems == null ? 3 : directMaxItems;
        this.parallelMaxItems = parallelMaxItems == null ? 6 : parallelMaxItems;
        this.strategicMaxItems = strategicMaxItems == null ? 10 : strategicMaxItems;
        this.domainEscalationThreshold = domainEscalationThreshold == null ? 4 : domainEscalationThreshold;
        if (this.directMaxItems > this.parallelMaxItems || this.parallelMaxItems > this.strategicMaxItems) {
            throw new IllegalArgumentException("Strategy thresholds must be ordered: direct <= parallel <= strategic");
        }
    }

    public static StrategyProperties defaults() {
        return new StrategyProperties(null, null, null, null);
    }

    public int getDirectMaxItems() {
        return directMaxItems;
    }

    public int getParallelMaxItems() {
        return parallelMaxItems;
    }

    public int getStrategicMaxItems() {
        return strategicMaxItems;
    }

    public int getDomainEscalationThreshold() {
        return domainEscalationThreshold;
    }
}
