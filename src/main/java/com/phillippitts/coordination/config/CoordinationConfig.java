package com.phillippitts.coordination.config;

import com.phillippitts.coordination.config.properties.AdmissionProperties;
import com.phillippitts.coordination.config.properties.LearningProperties;
import com.phillippitts.coordination.config.properties.PlannerProperties;
import com.phillippitts.coordination.config.properties.StrategyProperties;
import com.phillippitts.coordination.domain.ResourceBudget;
import com.phillippitts.coordination.service.admission.AdmissionController;
import com.phillippitts.coordination.service.insight.InsightGenerator;
import com.phillippitts.coordination.service.learning.AnalyticsCache;
import com.phillippitts.coordination.service.learning.CoordinationEventLog;
import com.phillippitts.coordination.service.learning.PatternLearner;
import com.phillippitts.coordination.service.metrics.CoordinationMetricsPublisher;
import com.phillippitts.coordination.service.orchestration.CoordinationEngine;
import com.phillippitts.coordination.service.orchestration.CoordinationEngineBuilder;
import com.phillippitts.coordination.service.planning.BatchPlanner;
import com.phillippitts.coordination.service.store.CoordinationStore;
import com.phillippitts.coordination.service.store.InMemoryCoordinationStore;
import com.phillippitts.coordination.service.store.JsonFileCoordinationStore;
import com.phillippitts.coordination.service.strategy.StrategySelector;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import org.springframework.boot.autoconfigure.condition.ConditionalOnMissingBean;
import org.springframework.context.ApplicationEventPublisher;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import java.nio.file.Path;
import java.time.Clock;

/**
 * Wires the coordination engine and its collaborators from typed properties.
 */
@Configuration
public class CoordinationConfig {

    private static final Logger LOG = LogManager.getLogger(CoordinationConfig.class);

    private final AdmissionProperties admissionProperties;
    private final StrategyProperties strategyProperties;
    private final PlannerProperties plannerProperties;
    private final LearningProperties learningProperties;

    public CoordinationConfig(AdmissionProperties admissionProperties,
                              StrategyProperties strategyProperties,
                              PlannerProperties plannerProperties,
                              LearningProperties learningProperties) {
        this.admissionProperties = admissionProperties;
        this.strategyProperties = strategyProperties;
        this.plannerProperties = plannerProperties;
        this.learningProperties = learningProperties;
    }

    @Bean
    @ConditionalOnMissingBean
    public Clock clock() {
        return Clock.systemUTC();
    }

    /**
     * Process-wide budget built from the admission and planner limits.
     */
    @Bean
    public ResourceBudget resourceBudget() {
        return new ResourceBudget(
                admissionProperties.getMaxConcurrentItems(),
                plannerProperties.getMaxBatchSize(),
                plannerProperties.getMaxResponseTimeSeconds(),
                plannerProperties.getMaxResourceUsage(),
                0.0);
    }

    @Bean
    public CoordinationStore coordinationStore() {
        if (learningProperties.getStore() == LearningProperties.StoreType.MEMORY) {
            LOG.info("Using in-memory coordination store; learned patterns are lost on restart");
            return new InMemoryCoordinationStore();
        }
        Path dir = Path.of(learningProperties.getDataDir());
        LOG.info("Using JSON file coordination store at {}", dir.toAbsolutePath());
        return new JsonFileCoordinationStore(dir);
    }

    @Bean
    public AdmissionController admissionController(ResourceBudget resourceBudget) {
        return new AdmissionController(admissionProperties, resourceBudget);
    }

    @Bean
    public StrategySelector strategySelector() {
        return new StrategySelector(strategyProperties);
    }

    @Bean
    public BatchPlanner batchPlanner() {
        return new BatchPlanner(plannerProperties, strategyProperties);
    }

    @Bean
    public CoordinationEventLog coordinationEventLog(CoordinationStore store, Clock clock) {
        return new CoordinationEventLog(store, clock, learningProperties.getMaxEvents());
    }

    @Bean
    public PatternLearner patternLearner(CoordinationStore store) {
        return new PatternLearner(store);
    }

    @Bean
    public InsightGenerator insightGenerator(CoordinationStore store, Clock clock) {
        return new InsightGenerator(store, clock, learningProperties.getInsightTtl(),
                learningProperties.getRecentWindow());
    }

    @Bean
    public AnalyticsCache analyticsCache(Clock clock) {
        return new AnalyticsCache(clock, learningProperties.getAnalyticsCacheTtl());
    }

    @Bean
    public CoordinationEngine coordinationEngine(AdmissionController admissionController,
                                                 StrategySelector strategySelector,
                                                 BatchPlanner batchPlanner,
                                                 CoordinationEventLog coordinationEventLog,
                                                 PatternLearner patternLearner,
                                                 InsightGenerator insightGenerator,
                                                 AnalyticsCache analyticsCache,
                                                 Clock clock,
                                                 ApplicationEventPublisher publisher,
                                                 CoordinationMetricsPublisher metricsPublisher) {
        return CoordinationEngineBuilder.builder()
                .admission(admissionController)
                .selector(strategySelector)
                .planner(batchPlanner)
                .eventLog(coordinationEventLog)
                .learner(patternLearner)
                .insights(insightGenerator)
                .analyticsCache(analyticsCache)
                .clock(clock)
                .recentWindow(learningProperties.getRecentWindow())
                .publisher(publisher)
                .metricsPublisher(metricsPublisher)
                .build();
    }
}
