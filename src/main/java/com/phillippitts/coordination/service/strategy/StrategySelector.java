package com.phillippitts.coordination.service.strategy;

import com.phillippitts.coordination.config.properties.StrategyProperties;
import com.phillippitts.coordination.domain.Strategy;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

import java.util.Collection;
import java.util.HashSet;
import java.util.Objects;

/**
 * Maps the shape of a request to a coordination {@link Strategy}.
 *
 * <p><b>Selection Algorithm:</b>
 * <ol>
 *   <li>Constraint violation or more than {@code strategicMaxItems} items → DEGRADED</li>
 *   <li>Up to {@code directMaxItems} → DIRECT</li>
 *   <li>Up to {@code parallelMaxItems} → PARALLEL</li>
 *   <li>Otherwise → STRATEGIC</li>
 *   <li>{@code domainEscalationThreshold} or more distinct domains raise the result to at least STRATEGIC</li>
 * </ol>
 *
 * <p>Stateless and thread-safe.
 *
 * @since 1.0
 */
public final class StrategySelector {

    private static final Logger LOG = LogManager.getLogger(StrategySelector.class);

    private final StrategyProperties props;

    public StrategySelector(StrategyProperties props) {
        this.props = Objects.requireNonNull(props, "props");
    }

    /**
     * Selects a strategy.
     *
     * @param itemCount number of work items
     * @param domains domains involved; duplicates are ignored, {@code null} means none
     * @param violatesConstraints whether admission control reported a capacity or budget violation
     * @return selected strategy (never null)
     */
    public Strategy select(int itemCount, Collection<String> domains, boolean violatesConstraints) {
        if (violatesConstraints || itemCount > props.getStrategicMaxItems()) {
            LOG.debug("Selected DEGRADED for {} items (violatesConstraints={})", itemCount, violatesConstraints);
            return Strategy.DEGRADED;
        }

        Strategy byCount;
        if (itemCount <= props.getDirectMaxItems()) {
            byCount = Strategy.DIRECT;
        } else if (itemCount <= props.getParallelMaxItems()) {
            byCount = Strategy.PARALLEL;
        } else {
            byCount = Strategy.STRATEGIC;
        }

        int distinctDomains = distinctDomainCount(domains);
        if (distinctDomains >= props.getDomainEscalationThreshold()) {
            Strategy escalated = byCount.atLeast(Strategy.STRATEGIC);
            LOG.debug("Escalated {} to {} for {} distinct domains", byCount, escalated, distinctDomains);
            return escalated;
        }
        return byCount;
    }

    /**
     * Coarse duration estimate in seconds for a request of {@code itemCount} items.
     */
    public double estimateDuration(int itemCount) {
        if (itemCount <= 1) {
            return 1.0;
        }
        if (itemCount <= 4) {
            return 2.0 + (itemCount - 1) * 0.5;
        }
        return 4.0 + (itemCount - 4) * 0.3;
    }

    static int distinctDomainCount(Collection<String> domains) {
        if (domains == null) {
            return 0;
        }
        return new HashSet<>(domains).size();
    }
}
