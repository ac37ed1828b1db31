package com.phillippitts.coordination.service.orchestration;

import com.phillippitts.coordination.service.admission.AdmissionController;
import com.phillippitts.coordination.service.insight.InsightGenerator;
import com.phillippitts.coordination.service.learning.AnalyticsCache;
import com.phillippitts.coordination.service.learning.CoordinationEventLog;
import com.phillippitts.coordination.service.learning.PatternLearner;
import com.phillippitts.coordination.service.metrics.CoordinationMetricsPublisher;
import com.phillippitts.coordination.service.planning.BatchPlanner;
import com.phillippitts.coordination.service.strategy.StrategySelector;
import org.springframework.context.ApplicationEventPublisher;

import java.time.Clock;
import java.time.Duration;
import java.util.Objects;

/**
 * Builder for {@link CoordinationEngine}.
 *
 * <p><b>Usage:</b>
 * <pre>{@code
 * CoordinationEngine engine = CoordinationEngineBuilder.builder()
 *     .admission(admissionController)
 *     .selector(strategySelector)
 *     .planner(batchPlanner)
 *     .eventLog(eventLog)
 *     .learner(patternLearner)
 *     .insights(insightGenerator)
 *     .analyticsCache(cache)
 *     .clock(clock)
 *     .recentWindow(Duration.ofHours(1))
 *     .publisher(publisher)
 *     .metricsPublisher(metricsPublisher)
 *     .build();
 * }</pre>
 *
 * <p>The publisher and metrics publisher are optional and default to no-ops; the clock defaults
 * to UTC system time and the recent window to one hour.
 *
 * @since 1.0
 */
public final class CoordinationEngineBuilder {

    private static final ApplicationEventPublisher NO_EVENTS = event -> { };

    // Required dependencies
    private AdmissionController admission;
    private StrategySelector selector;
    private BatchPlanner planner;
    private CoordinationEventLog eventLog;
    private PatternLearner learner;
    private InsightGenerator insights;
    private AnalyticsCache analyticsCache;

    // Optional dependencies
    private Clock clock = Clock.systemUTC();
    private Duration recentWindow = Duration.ofHours(1);
    private ApplicationEventPublisher publisher = NO_EVENTS;
    private CoordinationMetricsPublisher metricsPublisher = CoordinationMetricsPublisher.NOOP;

    private CoordinationEngineBuilder() {
        // Private constructor - use builder() factory method
    }

    public static CoordinationEngineBuilder builder() {
        return new CoordinationEngineBuilder();
    }

    public CoordinationEngineBuilder admission(AdmissionController admission) {
        this.admission = admission;
        return this;
    }

    public CoordinationEngineBuilder selector(StrategySelector selector) {
        this.selector = selector;
        return this;
    }

    public CoordinationEngineBuilder planner(BatchPlanner planner) {
        this.planner = planner;
        return this;
    }

    public CoordinationEngineBuilder eventLog(CoordinationEventLog eventLog) {
        this.eventLog = eventLog;
        return this;
    }

    public CoordinationEngineBuilder learner(PatternLearner learner) {
        this.learner = learner;
        return this;
    }

    public CoordinationEngineBuilder insights(InsightGenerator insights) {
        this.insights = insights;
        return this;
    }

    public CoordinationEngineBuilder analyticsCache(AnalyticsCache analyticsCache) {
        this.analyticsCache = analyticsCache;
        return this;
    }

    public CoordinationEngineBuilder clock(Clock clock) {
        this.clock = clock;
        return this;
    }

    public CoordinationEngineBuilder recentWindow(Duration recentWindow) {
        this.recentWindow = recentWindow;
        return this;
    }

    /**
     * @param publisher event publisher; {@code null} keeps the no-op default
     */
    public CoordinationEngineBuilder publisher(ApplicationEventPublisher publisher) {
        this.publisher = publisher == null ? NO_EVENTS : publisher;
        return this;
    }

    /**
     * @param metricsPublisher metrics publisher; {@code null} keeps {@link CoordinationMetricsPublisher#NOOP}
     */
    public CoordinationEngineBuilder metricsPublisher(CoordinationMetricsPublisher metricsPublisher) {
        this.metricsPublisher = metricsPublisher == null ? CoordinationMetricsPublisher.NOOP : metricsPublisher;
        return this;
    }

    /**
     * Builds the engine.
     *
     * @throws NullPointerException if a required dependency is missing
     */
    public CoordinationEngine build() {
        Objects.requireNonNull(admission, "admission is required");
        Objects.requireNonNull(selector, "selector is required");
        Objects.requireNonNull(planner, "planner is required");
        Objects.requireNonNull(eventLog, "eventLog is required");
        Objects.requireNonNull(learner, "learner is required");
        Objects.requireNonNull(insights, "insights is required");
        Objects.requireNonNull(analyticsCache, "analyticsCache is required");
        Objects.requireNonNull(clock, "clock is required");
        Objects.requireNonNull(recentWindow, "recentWindow is required");
        return new CoordinationEngine(this);
    }

    AdmissionController admission() {
        return admission;
    }

    StrategySelector selector() {
        return selector;
    }

    BatchPlanner planner() {
        return planner;
    }

    CoordinationEventLog eventLog() {
        return eventLog;
    }

    PatternLearner learner() {
        return learner;
    }

    InsightGenerator insights() {
        return insights;
    }

    AnalyticsCache analyticsCache() {
        return analyticsCache;
    }

    Clock clock() {
        return clock;
    }

    Duration recentWindow() {
        return recentWindow;
    }

    ApplicationEventPublisher publisher() {
        return publisher;
    }

    CoordinationMetricsPublisher metricsPublisher() {
        return metricsPublisher;
    }
}
