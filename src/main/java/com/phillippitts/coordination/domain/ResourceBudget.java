package com.phillippitts.coordination.domain;

/**
 * Process-wide resource limits for one coordination window.
 *
 * <p>Only the admission controller produces budgets that carry a non-zero
 * {@code currentResourceUsage}; planners treat the budget as read-only input.
 *
 * @param maxConcurrentItems hard cap on items per coordination request
 * @param maxBatchSize upper bound for a single batch before complexity adjustment
 * @param maxResponseTime response-time budget in seconds; plans estimated above it are degraded
 * @param maxResourceUsage usage ceiling in [0,1]
 * @param currentResourceUsage usage claimed by open coordination windows, in [0,1]
 */
public record ResourceBudget(
        int maxConcurrentItems,
        int maxBatchSize,
        double maxResponseTime,
        double maxResourceUsage,
        double currentResourceUsage
) {
    public static final int DEFAULT_MAX_CONCURRENT_ITEMS = 10;
    public static final int DEFAULT_MAX_BATCH_SIZE = 6;
    public static final double DEFAULT_MAX_RESPONSE_TIME = 30.0;

    public ResourceBudget {
        if (maxConcurrentItems <= 0) {
            throw new IllegalArgumentException("maxConcurrentItems must be positive");
        }
        if (maxBatchSize <= 0) {
            throw new IllegalArgumentException("maxBatchSize must be positive");
        }
        if (maxResourceUsage < 0 || maxResourceUsage > 1) {
            throw new IllegalArgumentException("maxResourceUsage must be in [0,1]");
        }
        currentResourceUsage = Math.max(0.0, Math.min(1.0, currentResourceUsage));
    }

    public static ResourceBudget defaults() {
        return new ResourceBudget(DEFAULT_MAX_CONCURRENT_ITEMS, DEFAULT_MAX_BATCH_SIZE,
                DEFAULT_MAX_RESPONSE_TIME, 1.0, 0.0);
    }

    public ResourceBudget withMaxBatchSize(int size) {
        return new ResourceBudget(maxConcurrentItems, size, maxResponseTime, maxResourceUsage, currentResourceUsage);
    }

    public ResourceBudget withCurrentResourceUsage(double usage) {
        return new ResourceBudget(maxConcurrentItems, maxBatchSize, maxResponseTime, maxResourceUsage, usage);
    }
}
