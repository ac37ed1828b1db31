package com.phillippitts.coordination.service.planning;

import com.phillippitts.coordination.config.properties.PlannerProperties;
import com.phillippitts.coordination.config.properties.StrategyProperties;
import com.phillippitts.coordination.domain.BatchingAdvice;
import com.phillippitts.coordination.domain.Complexity;
import com.phillippitts.coordination.domain.CoordinationPlan;
import com.phillippitts.coordination.domain.ResourceBudget;
import com.phillippitts.coordination.domain.Strategy;
import com.phillippitts.coordination.domain.WorkItem;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.Objects;

/**
 * Turns a list of work items into an ordered batch plan.
 *
 * <p><b>Planning steps:</b>
 * <ol>
 *   <li>Order by priority rank, then dependency count, then estimated duration (stable)</li>
 *   <li>Greedily fill batches, starting a new batch when the effective batch size is reached
 *       or when the next item and an item already in the batch depend on each other's kind</li>
 *   <li>Assign a strategy from the batch shape, reconciled with the selector's strategy when given</li>
 *   <li>Estimate time: per batch the longest item plus per-item overhead, plus inter-batch overhead</li>
 * </ol>
 *
 * <p>Every iteration places exactly one item, so fully dependent chains degrade to one item
 * per batch and the loop always terminates. Stateless and thread-safe.
 *
 * @since 1.0
 */
public final class BatchPlanner {

    private static final Logger LOG = LogManager.getLogger(BatchPlanner.class);

    static final Comparator<WorkItem> EXECUTION_ORDER = Comparator
            .comparingInt((WorkItem item) -> item.priority().rank())
            .thenComparingInt(item -> item.dependencies().size())
            .thenComparingDouble(WorkItem::estimatedDuration);

    private final PlannerProperties props;
    private final StrategyProperties strategyProps;

    public BatchPlanner(PlannerProperties props, StrategyProperties strategyProps) {
        this.props = Objects.requireNonNull(props, "props");
        this.strategyProps = Objects.requireNonNull(strategyProps, "strategyProps");
    }

    /**
     * Plans {@code items} using only the batch shape to pick a strategy.
     */
    public CoordinationPlan plan(List<WorkItem> items, ResourceBudget budget) {
        return plan(items, budget, null, Complexity.MEDIUM);
    }

    /**
     * Plans {@code items} under {@code budget}.
     *
     * @param items work items; {@code null} or empty yields {@link CoordinationPlan#empty()}
     * @param budget resource budget providing the batch size and response-time limits
     * @param selected strategy from the strategy selector, or {@code null}
     * @param complexity request complexity used to adjust the batch size
     * @return immutable plan
     */
    public CoordinationPlan plan(List<WorkItem> items, ResourceBudget budget,
                                 Strategy selected, Complexity complexity) {
        Objects.requireNonNull(budget, "budget");
        if (items == null || items.isEmpty()) {
            return CoordinationPlan.empty();
        }

        int batchSize = effectiveBatchSize(budget, complexity);
        List<List<WorkItem>> batches = buildBatches(order(items), batchSize);

        Strategy shape = strategyForShape(batches, items.size());
        Strategy strategy = reconcile(shape, selected, batches.size());
        double estimate = estimateTotalTime(batches);
        boolean overTime = budget.maxResponseTime() > 0 && estimate > budget.maxResponseTime();
        boolean degraded = strategy == Strategy.DEGRADED || overTime;

        LOG.debug("Planned {} items into {} batches (batchSize={}, strategy={}, estimate={}s, degraded={})",
                items.size(), batches.size(), batchSize, strategy, estimate, degraded);
        return new CoordinationPlan(batches, strategy, estimate, degraded);
    }

    /**
     * Budget batch size adjusted by complexity, clamped to the configured bounds and never above
     * the budget's own maximum.
     */
    public int effectiveBatchSize(ResourceBudget budget, Complexity complexity) {
        int adjustment = complexity == null ? 0 : complexity.batchSizeAdjustment();
        int clamped = clamp(budget.maxBatchSize() + adjustment);
        return Math.min(clamped, budget.maxBatchSize());
    }

    /**
     * Suggests a batch shape from the research-tuned optimal batch size.
     *
     * @param itemCount total items to coordinate
     * @param complexity request complexity
     * @return batch size and number of batches; counts at or under the size fit one batch
     */
    public BatchingAdvice suggestBatching(int itemCount, Complexity complexity) {
        int adjustment = complexity == null ? 0 : complexity.batchSizeAdjustment();
        int size = clamp(props.getOptimalBatchSize() + adjustment);
        if (itemCount <= size) {
            return new BatchingAdvice(Math.max(itemCount, 0), 1);
        }
        return new BatchingAdvice(size, (itemCount + size - 1) / size);
    }

    static List<WorkItem> order(List<WorkItem> items) {
        List<WorkItem> ordered = new ArrayList<>(items);
        ordered.sort(EXECUTION_ORDER);
        return ordered;
    }

    static List<List<WorkItem>> buildBatches(List<WorkItem> ordered, int batchSize) {
        List<List<WorkItem>> batches = new ArrayList<>();
        List<WorkItem> current = new ArrayList<>();
        for (WorkItem item : ordered) {
            if (!current.isEmpty() && (current.size() >= batchSize || conflicts(current, item))) {
                batches.add(current);
                current = new ArrayList<>();
            }
            current.add(item);
        }
        batches.add(current);
        return batches;
    }

    static boolean conflicts(List<WorkItem> batch, WorkItem next) {
        for (WorkItem member : batch) {
            if (next.dependsOn(member.kind()) || member.dependsOn(next.kind())) {
                return true;
            }
        }
        return false;
    }

    private Strategy strategyForShape(List<List<WorkItem>> batches, int totalItems) {
        if (batches.size() == 1 && totalItems <= strategyProps.getParallelMaxItems()) {
            return Strategy.PARALLEL;
        }
        if (totalItems <= strategyProps.getStrategicMaxItems()) {
            return Strategy.STRATEGIC;
        }
        return Strategy.DEGRADED;
    }

    private static Strategy reconcile(Strategy shape, Strategy selected, int batchCount) {
        if (selected == null) {
            return shape;
        }
        if (selected == Strategy.DEGRADED || shape == Strategy.DEGRADED) {
            return Strategy.DEGRADED;
        }
        if (selected == Strategy.DIRECT && batchCount == 1) {
            return Strategy.DIRECT;
        }
        return shape.atLeast(selected);
    }

    private double estimateTotalTime(List<List<WorkItem>> batches) {
        double total = 0.0;
        for (List<WorkItem> batch : batches) {
            double longest = batch.stream().mapToDouble(WorkItem::estimatedDuration).max().orElse(0.0);
            total += longest + batch.size() * props.getCoordinationOverheadSeconds();
        }
        return total + (batches.size() - 1) * props.getInterBatchOverheadSeconds();
    }

    private int clamp(int size) {
        return Math.max(props.getMinEffectiveBatchSize(), Math.min(size, props.getMaxEffectiveBatchSize()));
    }
}
