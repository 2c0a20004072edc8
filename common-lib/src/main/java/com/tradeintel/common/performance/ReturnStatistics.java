package com.tradeintel.common.performance;

import java.util.List;

/**
 * Stateless return-series statistics shared by every reducer.
 *
 * <p>Conventions:
 * <ul>
 *   <li>Inputs are percent returns (2.5 = +2.5%).</li>
 *   <li>{@code null} means "not enough data"; it is never replaced by zero.</li>
 *   <li>Division by a zero denominator with a non-zero numerator yields an infinity sentinel.</li>
 * </ul>
 */
public final class ReturnStatistics {

    /** Sharpe is reported per trade; no annualization is applied. */
    public static final double ANNUALIZATION_FACTOR = 1.0;

    /** Standard deviations below this are treated as zero variance. */
    static final double ZERO_VARIANCE = 1e-12;

    private ReturnStatistics() {}

    /** Percentage of {@code hits} over {@code total}; null when total is 0. */
    public static Double rate(int hits, int total) {
        return total == 0 ? null : hits * 100.0 / total;
    }

    public static Double mean(List<Double> values) {
        if (values.isEmpty()) return null;
        double sum = 0.0;
        for (double v : values) sum += v;
        return sum / values.size();
    }

    public static Double sum(List<Double> values) {
        if (values.isEmpty()) return null;
        double sum = 0.0;
        for (double v : values) sum += v;
        return sum;
    }

    /**
     * {@code mean / populationStdev × ANNUALIZATION_FACTOR}.
     *
     * <pre>
     *   n &lt; 2                  → null
     *   stdev = 0, mean &gt; 0    → +∞
     *   stdev = 0, mean &lt; 0    → −∞
     *   stdev = 0, mean = 0    → 0
     * </pre>
     */
    public static Double sharpe(List<Double> returns) {
        if (returns.size() < 2) return null;
        double mean = mean(returns);
        double sq = 0.0;
        for (double r : returns) sq += (r - mean) * (r - mean);
        double stdev = Math.sqrt(sq / returns.size());
        if (stdev < ZERO_VARIANCE) {
            if (mean > 0) return Double.POSITIVE_INFINITY;
            if (mean < 0) return Double.NEGATIVE_INFINITY;
            return 0.0;
        }
        return mean / stdev * ANNUALIZATION_FACTOR;
    }

    /**
     * Gross gain over gross loss. No losses with some gain is {@code +∞};
     * neither gains nor losses is {@code null}.
     */
    public static Double profitFactor(List<Double> returns) {
        double gains = 0.0;
        double losses = 0.0;
        for (double r : returns) {
            if (r > 0) gains += r;
            else if (r < 0) losses -= r;
        }
        if (losses == 0.0) {
            return gains > 0.0 ? Double.POSITIVE_INFINITY : null;
        }
        return gains / losses;
    }

    /**
     * Largest peak-to-trough fall of the cumulative return curve, in percentage points.
     * The curve starts at 0 before the first trade, so a losing first trade is a drawdown.
     *
     * @param chronologicalReturns returns already sorted oldest first
     * @return drawdown ≥ 0, or null for an empty series
     */
    public static Double maxDrawdown(List<Double> chronologicalReturns) {
        if (chronologicalReturns.isEmpty()) return null;
        double equity = 0.0;
        double peak = 0.0;
        double maxDd = 0.0;
        for (double r : chronologicalReturns) {
            equity += r;
            if (equity > peak) peak = equity;
            double dd = peak - equity;
            if (dd > maxDd) maxDd = dd;
        }
        return maxDd;
    }

    public static double clamp(double value, double min, double max) {
        return Math.max(min, Math.min(max, value));
    }
}
