package com.tradeintel.common.weights;

/**
 * Tuning for the signal weight engine.
 *
 * @param enabled          whether dynamic weights are applied upstream (reported, and used by
 *                         weighted-confidence); weights are computed either way
 * @param minWeight        clamp floor; strictly positive so no signal is ever disabled
 * @param maxWeight        clamp ceiling
 * @param baselineWinRate  neutral win rate in percent, maps to weight 1.0
 * @param priorStrength    pseudo-trade count pulling small samples toward 1.0
 * @param tierLow          trades needed to leave {@code untested}
 * @param tierMedium       trades needed for {@code medium}
 * @param tierHigh         trades needed for {@code high}
 * @param neutralEpsilon   effective weights within 1 ± epsilon count as neutral
 * @param topN             size of the top boosted / reduced lists
 */
public record WeightSettings(
    boolean enabled,
    double  minWeight,
    double  maxWeight,
    double  baselineWinRate,
    double  priorStrength,
    int     tierLow,
    int     tierMedium,
    int     tierHigh,
    double  neutralEpsilon,
    int     topN
) {

    public static final WeightSettings DEFAULTS =
        new WeightSettings(true, 0.3, 2.0, 50.0, 20.0, 10, 30, 100, 0.05, 10);

    public WeightSettings {
        if (!(minWeight > 0.0)) {
            throw new IllegalArgumentException("minWeight must be > 0, got " + minWeight);
        }
        if (!(maxWeight >= minWeight) || Double.isInfinite(maxWeight)) {
            throw new IllegalArgumentException("maxWeight must be finite and >= minWeight, got " + maxWeight);
        }
        if (minWeight > 1.0 || maxWeight < 1.0) {
            throw new IllegalArgumentException("clamp range must contain the neutral weight 1.0");
        }
        if (!(baselineWinRate > 0.0 && baselineWinRate < 100.0)) {
            throw new IllegalArgumentException("baselineWinRate must be in (0, 100), got " + baselineWinRate);
        }
        if (priorStrength < 0.0) {
            throw new IllegalArgumentException("priorStrength must be >= 0, got " + priorStrength);
        }
        if (tierLow < 1 || tierMedium < tierLow || tierHigh < tierMedium) {
            throw new IllegalArgumentException(
                "tier thresholds must satisfy 1 <= low <= medium <= high, got "
                + tierLow + "/" + tierMedium + "/" + tierHigh);
        }
        if (neutralEpsilon < 0.0 || topN < 1) {
            throw new IllegalArgumentException("neutralEpsilon must be >= 0 and topN >= 1");
        }
    }

    public WeightSettings withEnabled(boolean on) {
        return new WeightSettings(on, minWeight, maxWeight, baselineWinRate, priorStrength,
                                  tierLow, tierMedium, tierHigh, neutralEpsilon, topN);
    }
}
