package com.phillippitts.coordination.config.properties;

import jakarta.validation.constraints.Min;
import jakarta.validation.constraints.Positive;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.boot.context.properties.bind.ConstructorBinding;
import org.springframework.validation.annotation.Validated;

/**
 * Typed properties for admission control.
 *
 * <p>Cost estimate: {@code baseCost + n * perItemCost + min(n * perItemOverhead, overheadCap)}.
 */
@Validated
@ConfigurationProperties(prefix = "coordination.admission")
public class AdmissionProperties {

    @Positive
    private final int maxConcurrentItems;

    @Positive
    private final int tokenWarningThreshold;

    @Min(0)
    private final int baseCost;

    @Min(0)
    private final int perItemCost;

    @Min(0)
    private final int perItemOverhead;

    @Min(0)
    private final int overheadCap;

    /**
     * Number of coordination windows that may be open at once. 1 means single-flight.
     */
    @Positive
    private final int maxOpenWindows;

    @ConstructorBinding
    public AdmissionProperties(Integer maxConcurrentItems,
                               Integer tokenWarningThreshold,
                               Integer baseCost,
                               Integer perItemCost,
                               Integer perItemOverhead,
                               Integer overheadCap,
                               Integer maxOpenWindows) {
        this.maxConcurrentItems = maxConcurrentItems == null ? 10 : maxConcurrentItems;
        this.tokenWarningThreshold = tokenWarningThreshold == null ? 8000 : tokenWarningThreshold;
        this.baseCost = baseCost == null ? 200 : baseCost;
        this.perItemCost = perItemCost == null ? 500 : perItemCost;
        this.perItemOverhead = perItemOverhead == null ? 50 : perItemOverhead;
        this.overheadCap = overheadCap == null ? 500 : overheadCap;
        this.maxOpenWindows = maxOpenWindows == null ? 1 : maxOpenWindows;
    }

    /**
     * Defaults for tests and hand-built engines.
     */
    public static AdmissionProperties defaults() {
        return new AdmissionProperties(null, null, null, null, null, null, null);
    }

    public int getMaxConcurrentItems() {
        return maxConcurrentItems;
    }

    public int getTokenWarningThreshold() {
        return tokenWarningThreshold;
    }

    public int getBaseCost() {
        return baseCost;
    }

    public int getPerItemCost() {
        return perItemCost;
    }

    public int getPerItemOverhead() {
        return perItemOverhead;
    }

    public int getOverheadCap() {
        return overheadCap;
    }

    public int getMaxOpenWindows() {
        return maxOpenWindows;
    }
}
