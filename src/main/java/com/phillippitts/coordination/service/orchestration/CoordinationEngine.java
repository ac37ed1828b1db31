package com.phillippitts.coordination.service.orchestration;

import com.phillippitts.coordination.domain.AdmissionDecision;
import com.phillippitts.coordination.domain.BatchingAdvice;
import com.phillippitts.coordination.domain.Complexity;
import com.phillippitts.coordination.domain.CoordinationAnalytics;
import com.phillippitts.coordination.domain.CoordinationEvent;
import com.phillippitts.coordination.domain.CoordinationEventType;
import com.phillippitts.coordination.domain.CoordinationPlan;
import com.phillippitts.coordination.domain.Insight;
import com.phillippitts.coordination.domain.Pattern;
import com.phillippitts.coordination.domain.PersistenceFailure;
import com.phillippitts.coordination.domain.Recommendation;
import com.phillippitts.coordination.domain.ResourceBudget;
import com.phillippitts.coordination.domain.Strategy;
import com.phillippitts.coordination.domain.WorkItem;
import com.phillippitts.coordination.exception.PersistenceException;
import com.phillippitts.coordination.service.admission.AdmissionController;
import com.phillippitts.coordination.service.events.OrphanCompletionEvent;
import com.phillippitts.coordination.service.events.PersistenceFailureEvent;
import com.phillippitts.coordination.service.insight.InsightGenerator;
import com.phillippitts.coordination.service.insight.StrategyRecommender;
import com.phillippitts.coordination.service.learning.AnalyticsAggregator;
import com.phillippitts.coordination.service.learning.AnalyticsCache;
import com.phillippitts.coordination.service.learning.CoordinationEventLog;
import com.phillippitts.coordination.service.learning.CoordinationEventLog.TerminalRecord;
import com.phillippitts.coordination.service.learning.PatternLearner;
import com.phillippitts.coordination.service.metrics.CoordinationMetricsPublisher;
import com.phillippitts.coordination.service.planning.BatchPlanner;
import com.phillippitts.coordination.service.store.CoordinationStore;
import com.phillippitts.coordination.service.strategy.StrategySelector;
import org.apache.logging.log4j.CloseableThreadContext;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import org.springframework.context.ApplicationEventPublisher;

import java.time.Clock;
import java.time.Duration;
import java.util.ArrayList;
import java.util.Collection;
import java.util.HashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.TreeMap;
import java.util.UUID;
import java.util.concurrent.locks.Lock;
import java.util.concurrent.locks.ReentrantLock;

/**
 * Facade over admission, strategy selection, planning and pattern learning.
 *
 * <p><b>Decision path:</b> {@link #coordinate(List, boolean)} admits the request, opens a
 * coordination window, selects a strategy, plans batches and attaches a pattern-based
 * recommendation. The engine never executes work items; the caller executes the plan and reports
 * back through {@link #reportStart}, {@link #reportComplete} and {@link #reportTimeout}. A terminal
 * report closes the window opened for the same id.
 *
 * <p><b>Learning path:</b> each report is appended to the event log, folded into the pattern
 * store when it completes a known START, and written to the store. Write failures never undo the
 * in-memory update; they are returned in {@link ReportResult}, published as
 * {@link PersistenceFailureEvent} and kept until the next successful write of that collection.
 *
 * <p><b>Thread Safety:</b> learning state is guarded by a single {@link ReentrantLock};
 * admission keeps its own lock so {@link #canAdmit(int)} never waits on store writes.
 *
 * @since 1.0
 * @see CoordinationEngineBuilder
 */
public final class CoordinationEngine {

    private static final Logger LOG = LogManager.getLogger(CoordinationEngine.class);
    private static final String MDC_KEY = "coordinationId";

    private final AdmissionController admission;
    private final StrategySelector selector;
    private final BatchPlanner planner;
    private final CoordinationEventLog eventLog;
    private final PatternLearner learner;
    private final InsightGenerator insights;
    private final AnalyticsCache analyticsCache;
    private final Clock clock;
    private final Duration recentWindow;
    private final ApplicationEventPublisher publisher;
    private final CoordinationMetricsPublisher metrics;

    private final Lock lock = new ReentrantLock();
    private final Set<String> openWindowIds = new HashSet<>();
    private final Map<String, PersistenceFailure> outstandingFailures = new TreeMap<>();

    CoordinationEngine(CoordinationEngineBuilder b) {
        this.admission = b.admission();
        this.selector = b.selector();
        this.planner = b.planner();
        this.eventLog = b.eventLog();
        this.learner = b.learner();
        this.insights = b.insights();
        this.analyticsCache = b.analyticsCache();
        this.clock = b.clock();
        this.recentWindow = b.recentWindow();
        this.publisher = b.publisher();
        this.metrics = b.metricsPublisher();
    }

    // ---- decision path ----

    public AdmissionDecision canAdmit(int itemCount) {
        return admission.canAdmit(itemCount);
    }

    /**
     * Opens a coordination window for {@code id} without an admission check. The window is
     * released by the terminal report for the id or by {@link #closeWindow(String)}.
     *
     * @return {@code false} if a window is already open for the id
     */
    public boolean beginWindow(String id) {
        lock.lock();
        try {
            if (!openWindowIds.add(id)) {
                return false;
            }
        } finally {
            lock.unlock();
        }
        admission.beginWindow();
        LOG.debug("Coordination window opened for id={}", id);
        return true;
    }

    public int openWindows() {
        return admission.openWindows();
    }

    public Strategy selectStrategy(int itemCount, Collection<String> domains, boolean violatesConstraints) {
        return selector.select(itemCount, domains, violatesConstraints);
    }

    public CoordinationPlan plan(List<WorkItem> items, ResourceBudget budget) {
        CoordinationPlan plan = planner.plan(items, budget);
        metrics.recordPlan(plan);
        return plan;
    }

    public CoordinationPlan plan(List<WorkItem> items, ResourceBudget budget, Strategy selected,
                                 Complexity complexity) {
        CoordinationPlan plan = planner.plan(items, budget, selected, complexity);
        metrics.recordPlan(plan);
        return plan;
    }

    public BatchingAdvice suggestBatching(int itemCount, Complexity complexity) {
        return planner.suggestBatching(itemCount, complexity);
    }

    public int estimateCost(int itemCount) {
        return admission.estimateCost(itemCount);
    }

    public double estimateDuration(int itemCount) {
        return selector.estimateDuration(itemCount);
    }

    public ResourceBudget currentBudget() {
        return admission.currentBudget();
    }

    /**
     * Admits, selects and plans in one step.
     *
     * <p>When admission rejects the request for capacity or budget and {@code allowDegraded} is
     * set, a DEGRADED plan is still returned, without opening a window. Other rejections return
     * an outcome without a plan.
     *
     * @param items work items to plan
     * @param allowDegraded whether constraint violations may produce a degraded plan
     * @return outcome carrying the id the caller reports against
     */
    public CoordinationOutcome coordinate(List<WorkItem> items, boolean allowDegraded) {
        List<WorkItem> safeItems = items == null ? List.of() : items;
        String id = UUID.randomUUID().toString();
        try (CloseableThreadContext.Instance ignored = CloseableThreadContext.put(MDC_KEY, id)) {
            List<String> domains = safeItems.stream().map(WorkItem::domain).distinct().sorted().toList();
            Recommendation recommendation = recommend(domains, safeItems.size());

            AdmissionDecision decision = admission.tryAdmit(safeItems.size());
            metrics.recordAdmission(decision);
            if (!decision.admitted()) {
                if (allowDegraded && decision.violatesConstraints()) {
                    CoordinationPlan degraded = plan(safeItems, admission.currentBudget(), Strategy.DEGRADED,
                            Complexity.MEDIUM);
                    LOG.info("Admission rejected ({}); returning degraded plan with {} batches",
                            decision.rejection(), degraded.batchCount());
                    return new CoordinationOutcome(id, decision, Strategy.DEGRADED, degraded, recommendation, false);
                }
                return new CoordinationOutcome(id, decision, null, null, recommendation, false);
            }

            lock.lock();
            try {
                openWindowIds.add(id);
            } finally {
                lock.unlock();
            }
            Strategy strategy = selector.select(safeItems.size(), domains, false);
            CoordinationPlan plan = plan(safeItems, admission.currentBudget(), strategy, Complexity.MEDIUM);
            LOG.info("Coordination admitted: items={}, strategy={}, batches={}, estimate={}s",
                    safeItems.size(), plan.strategy(), plan.batchCount(), plan.estimatedTotalTime());
            return new CoordinationOutcome(id, decision, strategy, plan, recommendation, true);
        }
    }

    /**
     * Closes the window opened by {@link #coordinate} for {@code id}.
     *
     * @return {@code false} if no window was open for the id
     */
    public boolean closeWindow(String id) {
        lock.lock();
        try {
            if (!openWindowIds.remove(id)) {
                return false;
            }
        } finally {
            lock.unlock();
        }
        admission.endWindow();
        LOG.debug("Coordination window closed for id={}", id);
        return true;
    }

    // ---- learning path ----

    public ReportResult reportStart(String id, int itemCount, List<String> domains, String strategy,
                                    List<String> itemKinds) {
        try (CloseableThreadContext.Instance ignored = CloseableThreadContext.put(MDC_KEY, id)) {
            lock.lock();
            try {
                CoordinationEvent start = eventLog.recordStart(id, itemCount, domains, strategy, itemKinds);
                analyticsCache.invalidate();
                List<PersistenceFailure> failures = new ArrayList<>();
                persist(CoordinationStore.EVENTS, id, eventLog::persist, failures);
                LOG.debug("Coordination started: items={}, strategy={}", itemCount, start.strategy());
                return new ReportResult(start, false, null, failures);
            } finally {
                lock.unlock();
            }
        }
    }

    /**
     * Reports the end of a coordination as COMPLETE on success or ERROR on failure.
     */
    public ReportResult reportComplete(String id, boolean success, String errorMessage) {
        CoordinationEventType type = success ? CoordinationEventType.COMPLETE : CoordinationEventType.ERROR;
        return reportTerminal(id, type, success, errorMessage);
    }

    /**
     * Reports that the executor gave up on a coordination. Learned as a failure.
     */
    public ReportResult reportTimeout(String id, String message) {
        return reportTerminal(id, CoordinationEventType.TIMEOUT, false, message);
    }

    private ReportResult reportTerminal(String id, CoordinationEventType type, boolean success, String errorMessage) {
        try (CloseableThreadContext.Instance ignored = CloseableThreadContext.put(MDC_KEY, id)) {
            ReportResult result;
            lock.lock();
            try {
                TerminalRecord rec = eventLog.recordTerminal(id, type, success, errorMessage);
                analyticsCache.invalidate();
                metrics.recordCompletion(rec.event());

                Pattern learned = rec.isLearnable() ? learner.learn(rec.start(), rec.event()) : null;
                List<PersistenceFailure> failures = new ArrayList<>();
                persist(CoordinationStore.EVENTS, id, eventLog::persist, failures);
                if (learned != null) {
                    persist(CoordinationStore.PATTERNS, id, learner::persist, failures);
                }
                result = new ReportResult(rec.event(), rec.isOrphan(), learned, failures);
            } finally {
                lock.unlock();
            }
            if (result.orphan()) {
                publisher.publishEvent(new OrphanCompletionEvent(id, type, result.event().timestamp()));
            }
            closeWindow(id);
            return result;
        }
    }

    // ---- query surface ----

    public CoordinationAnalytics getAnalytics() {
        lock.lock();
        try {
            return analyticsCache.get(() -> AnalyticsAggregator.aggregate(eventLog.events(), learner.patterns(),
                    insights.retained().size(), clock.instant(), recentWindow));
        } finally {
            lock.unlock();
        }
    }

    /**
     * Runs the insight rules and writes the retained insights.
     *
     * @return insights produced by this run and any failure writing them
     */
    public InsightsResult generateInsights() {
        CoordinationAnalytics analytics = getAnalytics();
        lock.lock();
        try {
            List<Insight> generated = insights.generate(learner.patterns(), analytics);
            analyticsCache.invalidate();
            List<PersistenceFailure> failures = new ArrayList<>();
            persist(CoordinationStore.INSIGHTS, null, insights::persist, failures);
            return new InsightsResult(generated, failures);
        } finally {
            lock.unlock();
        }
    }

    public List<Insight> retainedInsights() {
        lock.lock();
        try {
            return insights.retained();
        } finally {
            lock.unlock();
        }
    }

    public Recommendation recommend(Collection<String> domains, int itemCount) {
        lock.lock();
        try {
            return StrategyRecommender.recommend(learner.patterns(), domains, itemCount);
        } finally {
            lock.unlock();
        }
    }

    public List<Pattern> patterns() {
        lock.lock();
        try {
            return learner.patterns();
        } finally {
            lock.unlock();
        }
    }

    public int eventCount() {
        lock.lock();
        try {
            return eventLog.size();
        } finally {
            lock.unlock();
        }
    }

    /**
     * Latest unresolved write failure per collection; cleared by the next successful write.
     */
    public Map<String, PersistenceFailure> outstandingPersistenceFailures() {
        lock.lock();
        try {
            return Map.copyOf(outstandingFailures);
        } finally {
            lock.unlock();
        }
    }

    private void persist(String collection, String coordinationId, Runnable write, List<PersistenceFailure> sink) {
        try {
            write.run();
            outstandingFailures.remove(collection);
        } catch (PersistenceException e) {
            PersistenceFailure failure = new PersistenceFailure(collection, e.getMessage(), clock.instant());
            outstandingFailures.put(collection, failure);
            sink.add(failure);
            metrics.recordPersistenceFailure(collection);
            publisher.publishEvent(new PersistenceFailureEvent(collection, coordinationId, e.getMessage(),
                    e.getCause(), failure.at()));
        }
    }
}
