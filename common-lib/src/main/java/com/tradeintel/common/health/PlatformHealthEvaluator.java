package com.tradeintel.common.health;

import com.tradeintel.common.model.EngineMetrics;
import com.tradeintel.common.model.HealthStatus;
import com.tradeintel.common.model.PlatformHealth;

import java.util.List;

/**
 * Derives the platform status from aggregate expectancy and profit factor.
 *
 * <pre>
 *   no closed trades                                   → degraded
 *   expectancy ≤ 0  or  PF &lt; unhealthyMaxProfitFactor   → unhealthy
 *   trades &lt; minTrades or PF &lt; healthyMinProfitFactor
 *     or any sufficiently sampled engine is unhealthy  → degraded
 *   otherwise                                          → healthy
 * </pre>
 * An engine is unhealthy when its expectancy is negative or its profit factor is below 1.
 */
public final class PlatformHealthEvaluator {

    private PlatformHealthEvaluator() {}

    public static PlatformHealth evaluate(EngineMetrics aggregate, List<EngineMetrics> engines,
                                          HealthThresholds thresholds) {
        List<String> unhealthyEngines = engines.stream()
            .filter(e -> e.tradeCount() >= thresholds.minEngineTrades())
            .filter(PlatformHealthEvaluator::isUnhealthy)
            .map(EngineMetrics::key)
            .toList();

        HealthStatus status = status(aggregate, unhealthyEngines, thresholds);
        return new PlatformHealth(status, aggregate.tradeCount(), aggregate.expectancy(),
                                  aggregate.profitFactor(), aggregate.winRate(),
                                  unhealthyEngines, List.of(), List.of());
    }

    public static boolean isUnhealthy(EngineMetrics m) {
        if (m.expectancy() != null && m.expectancy() < 0.0) return true;
        return m.profitFactor() != null && m.profitFactor() < 1.0;
    }

    private static HealthStatus status(EngineMetrics aggregate, List<String> unhealthyEngines,
                                       HealthThresholds t) {
        if (aggregate.tradeCount() == 0 || aggregate.expectancy() == null) {
            return HealthStatus.DEGRADED;
        }
        double pf = aggregate.profitFactor() == null ? 0.0 : aggregate.profitFactor();
        if (aggregate.expectancy() <= 0.0 || pf < t.unhealthyMaxProfitFactor()) {
            return HealthStatus.UNHEALTHY;
        }
        if (aggregate.tradeCount() < t.minTrades()
                || pf < t.healthyMinProfitFactor()
                || !unhealthyEngines.isEmpty()) {
            return HealthStatus.DEGRADED;
        }
        return HealthStatus.HEALTHY;
    }
}
