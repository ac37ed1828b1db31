package com.phillippitts.coordination.domain;

/**
 * Suggested batch shape for a given item count.
 */
public record BatchingAdvice(int batchSize, int numBatches) {
}
