package com.tradeintel.common.health;

/**
 * @param healthyMinProfitFactor    profit factor required for {@code healthy}
 * @param unhealthyMaxProfitFactor  profit factor below which the platform is {@code unhealthy}
 * @param minTrades                 closed trades below which the verdict is at best {@code degraded}
 * @param minEngineTrades           closed trades an engine needs before it can be flagged
 */
public record HealthThresholds(
    double healthyMinProfitFactor,
    double unhealthyMaxProfitFactor,
    int    minTrades,
    int    minEngineTrades
) {

    public static final HealthThresholds DEFAULTS = new HealthThresholds(1.2, 1.0, 20, 10);

    public HealthThresholds {
        if (healthyMinProfitFactor < unhealthyMaxProfitFactor) {
            throw new IllegalArgumentException("healthyMinProfitFactor must be >= unhealthyMaxProfitFactor");
        }
        if (minTrades < 0 || minEngineTrades < 0) {
            throw new IllegalArgumentException("trade minimums must be >= 0");
        }
    }
}
