package com.phillippitts.coordination.domain;

/**
 * Coarse complexity of a coordination request, used to shrink batches for complex work.
 */
public enum Complexity {
    LOW(0),
    MEDIUM(0),
    HIGH(-1);

    private final int batchSizeAdjustment;

    Complexity(int batchSizeAdjustment) {
        this.batchSizeAdjustment = batchSizeAdjustment;
    }

    public int batchSizeAdjustment() {
        return batchSizeAdjustment;
    }
}
