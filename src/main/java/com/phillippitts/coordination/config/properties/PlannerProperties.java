package com.phillippitts.coordination.config.properties;

import jakarta.validation.constraints.DecimalMax;
import jakarta.validation.constraints.DecimalMin;
import jakarta.validation.constraints.Positive;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.boot.context.properties.bind.ConstructorBinding;
import org.springframework.validation.annotation.Validated;

/**
 * Typed properties for batch planning and the default resource budget.
 */
@Validated
@ConfigurationProperties(prefix = "coordination.planner")
public class PlannerProperties {

    @Positive
    private final int maxBatchSize;

    /** Research-tuned batch size used for batching advice. */
    @Positive
    private final int optimalBatchSize;

    @Positive
    private final int minEffectiveBatchSize;

    @Positive
    private final int maxEffectiveBatchSize;

    @DecimalMin("0.0")
    private final double coordinationOverheadSeconds;

    @DecimalMin("0.0")
    private final double interBatchOverheadSeconds;

    /** Plans estimated above this are flagged degraded. 0 disables the check. */
    @DecimalMin("0.0")
    private final double maxResponseTimeSeconds;

    @DecimalMin("0.0")
    @DecimalMax("1.0")
    private final double maxResourceUsage;

    @ConstructorBinding
    public PlannerProperties(Integer maxBatchSize,
                             Integer optimalBatchSize,
                             Integer minEffectiveBatchSize,
                             Integer maxEffectiveBatchSize,
                             Double coordinationOverheadSeconds,
                             Double interBatchOverheadSeconds,
                             Double maxResponseTimeSeconds,
                             Double maxResourceUsage) {
        this.maxBatchSize = maxBatchSize == null ? 6 : maxBatchSize;
        this.optimalBatchSize = optimalBatchSize == null ? 4 : optimalBatchSize;
        this.minEffectiveBatchSize = minEffectiveBatchSize == null ? 2 : minEffectiveBatchSize;
        this.maxEffectiveBatchSize = maxEffectiveBatchSize == null ? 5 : maxEffectiveBatchSize;
        this.coordinationOverheadSeconds = coordinationOverheadSeconds == null ? 0.1 : coordinationOverheadSeconds;
        this.interBatchOverheadSeconds = interBatchOverheadSeconds == null ? 0.5 : interBatchOverheadSeconds;
        this.maxResponseTimeSeconds = maxResponseTimeSeconds == null ? 30.0 : maxResponseTimeSeconds;
        this.maxResourceUsage = maxResourceUsage == null ? 1.0 : maxResourceUsage;
        if (this.minEffectiveBatchSize > this.maxEffectiveBatchSize) {
            throw new IllegalArgumentException("minEffectiveBatchSize must not exceed maxEffectiveBatchSize");
        }
    }

    public static PlannerProperties defaults() {
        return new PlannerProperties(null, null, null, null, null, null, null, null);
    }

    public int getMaxBatchSize() {
        return maxBatchSize;
    }

    public int getOptimalBatchSize() {
        return optimalBatchSize;
    }

    public int getMinEffectiveBatchSize() {
        return minEffectiveBatchSize;
    }

    public int getMaxEffectiveBatchSize() {
        return maxEffectiveBatchSize;
    }

    public double getCoordinationOverheadSeconds() {
        return coordinationOverheadSeconds;
    }

    public double getInterBatchOverheadSeconds() {
        return interBatchOverheadSeconds;
    }

    public double getMaxResponseTimeSeconds() {
        return maxResponseTimeSeconds;
    }

    public double getMaxResourceUsage() {
        return maxResourceUsage;
    }
}
