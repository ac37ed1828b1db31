package com.phillippitts.coordination.service.admission;

import com.phillippitts.coordination.config.properties.AdmissionProperties;
import com.phillippitts.coordination.domain.AdmissionDecision;
import com.phillippitts.coordination.domain.ResourceBudget;
import com.phillippitts.coordination.exception.CoordinationErrorKind;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

import java.util.Objects;
import java.util.concurrent.locks.Lock;
import java.util.concurrent.locks.ReentrantLock;

/**
 * Validates proposed coordination requests against hard limits and tracks open
 * coordination windows.
 *
 * <p><b>Checks, in order:</b>
 * <ol>
 *   <li>{@code itemCount <= 0} → {@link CoordinationErrorKind#INVALID_COUNT}</li>
 *   <li>{@code itemCount > maxConcurrentItems} → {@link CoordinationErrorKind#OVER_CAPACITY}</li>
 *   <li>open windows at the limit → {@link CoordinationErrorKind#BUSY}</li>
 *   <li>estimated cost above the warning threshold → {@link CoordinationErrorKind#BUDGET_EXCEEDED}</li>
 * </ol>
 *
 * <p>{@link #canAdmit(int)} has no side effect. Callers open and close windows explicitly with
 * {@link #beginWindow()} and {@link #endWindow()}, or atomically check and open with
 * {@link #tryAdmit(int)}.
 *
 * <p><b>Thread Safety:</b> the open-window counter is the only mutable state and is guarded
 * by a {@link ReentrantLock}.
 *
 * @since 1.0
 */
public final class AdmissionController {

    private static final Logger LOG = LogManager.getLogger(AdmissionController.class);

    private final AdmissionProperties props;
    private final ResourceBudget budget;
    private final Lock lock = new ReentrantLock();
    private int openWindows;

    /**
     * @param props admission limits and cost model
     * @param budget process-wide budget; its {@code maxConcurrentItems} is the capacity limit
     */
    public AdmissionController(AdmissionProperties props, ResourceBudget budget) {
        this.props = Objects.requireNonNull(props, "props");
        this.budget = Objects.requireNonNull(budget, "budget");
    }

    /**
     * Checks whether a request of {@code itemCount} items may start now.
     *
     * @param itemCount number of work items in the request
     * @return admitted decision with reason {@code "ok"}, or a rejection with its kind
     */
    public AdmissionDecision canAdmit(int itemCount) {
        lock.lock();
        try {
            return evaluate(itemCount);
        } finally {
            lock.unlock();
        }
    }

    /**
     * Checks the request and, when admitted, opens a coordination window in the same critical section.
     *
     * @param itemCount number of work items in the request
     * @return the admission decision; a window is open only if {@link AdmissionDecision#admitted()}
     */
    public AdmissionDecision tryAdmit(int itemCount) {
        lock.lock();
        try {
            AdmissionDecision decision = evaluate(itemCount);
            if (decision.admitted()) {
                openWindows++;
                LOG.debug("Coordination window opened for {} items (open={})", itemCount, openWindows);
            }
            return decision;
        } finally {
            lock.unlock();
        }
    }

    /**
     * Opens a coordination window.
     */
    public void beginWindow() {
        lock.lock();
        try {
            openWindows++;
        } finally {
            lock.unlock();
        }
    }

    /**
     * Closes a coordination window. The counter never drops below zero.
     */
    public void endWindow() {
        lock.lock();
        try {
            if (openWindows == 0) {
                LOG.debug("endWindow called with no open window");
                return;
            }
            openWindows--;
        } finally {
            lock.unlock();
        }
    }

    public int openWindows() {
        lock.lock();
        try {
            return openWindows;
        } finally {
            lock.unlock();
        }
    }

    /**
     * Returns the process-wide budget with {@code currentResourceUsage} reflecting open windows.
     */
    public ResourceBudget currentBudget() {
        double usage = (double) openWindows() / props.getMaxOpenWindows();
        return budget.withCurrentResourceUsage(usage);
    }

    /**
     * Estimates token/resource cost: {@code base + n*perItem + min(n*perItemOverhead, overheadCap)}.
     */
    public int estimateCost(int itemCount) {
        int n = Math.max(0, itemCount);
        int overhead = Math.min(n * props.getPerItemOverhead(), props.getOverheadCap());
        return props.getBaseCost() + n * props.getPerItemCost() + overhead;
    }

    private AdmissionDecision evaluate(int itemCount) {
        if (itemCount <= 0) {
            return reject(CoordinationErrorKind.INVALID_COUNT, "Invalid item count: " + itemCount, 0);
        }
        int cost = estimateCost(itemCount);
        if (itemCount > budget.maxConcurrentItems()) {
            return reject(CoordinationErrorKind.OVER_CAPACITY,
                    "Exceeds limit of " + budget.maxConcurrentItems() + " concurrent items", cost);
        }
        if (openWindows >= props.getMaxOpenWindows()) {
            return reject(CoordinationErrorKind.BUSY, "Another coordination is already in progress", cost);
        }
        if (cost > props.getTokenWarningThreshold()) {
            return reject(CoordinationErrorKind.BUDGET_EXCEEDED,
                    "Estimated cost (" + cost + ") exceeds warning threshold of "
                            + props.getTokenWarningThreshold(), cost);
        }
        return AdmissionDecision.admit(cost);
    }

    private static AdmissionDecision reject(CoordinationErrorKind kind, String reason, int cost) {
        LOG.warn("Admission rejected: kind={}, reason={}", kind, reason);
        return AdmissionDecision.reject(kind, reason, cost);
    }
}
