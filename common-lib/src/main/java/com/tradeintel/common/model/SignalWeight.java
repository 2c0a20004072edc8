package com.tradeintel.common.model;

import com.fasterxml.jackson.annotation.JsonIgnore;
import com.fasterxml.jackson.annotation.JsonProperty;

/**
 * Per-signal statistics and weight. {@code effectiveWeight} equals {@code overrideWeight}
 * when {@code overridden} is set, otherwise {@code dynamicWeight}.
 */
public record SignalWeight(
    @JsonProperty("signal")          String         signal,
    @JsonProperty("baseWeight")      double         baseWeight,
    @JsonProperty("dynamicWeight")   double         dynamicWeight,
    @JsonProperty("effectiveWeight") double         effectiveWeight,
    @JsonProperty("tradeCount")      int            tradeCount,
    @JsonProperty("wins")            int            wins,
    @JsonProperty("losses")          int            losses,
    @JsonProperty("breakevens")      int            breakevens,
    @JsonProperty("winRate")         Double         winRate,
    @JsonProperty("avgReturn")       Double         avgReturn,
    @JsonProperty("tier")            ConfidenceTier tier,
    @JsonProperty("overridden")      boolean        overridden,
    @JsonProperty("overrideWeight")  Double         overrideWeight
) {

    public static final double BASE_WEIGHT = 1.0;

    public static SignalWeight of(String signal, int trades, int wins, int losses, int breakevens,
                                  Double winRate, Double avgReturn, ConfidenceTier tier,
                                  WeightAssignment assignment) {
        boolean overridden = assignment instanceof WeightAssignment.Overridden;
        return new SignalWeight(signal, BASE_WEIGHT, assignment.computedWeight(), assignment.effectiveWeight(),
                                trades, wins, losses, breakevens, winRate, avgReturn, tier,
                                overridden, overridden ? assignment.effectiveWeight() : null);
    }

    @JsonIgnore
    public WeightAssignment assignment() {
        return overridden
            ? new WeightAssignment.Overridden(overrideWeight, dynamicWeight)
            : new WeightAssignment.Computed(dynamicWeight);
    }

    /** Same statistics with a different weight decision. */
    public SignalWeight withAssignment(WeightAssignment assignment) {
        return of(signal, tradeCount, wins, losses, breakevens, winRate, avgReturn, tier, assignment);
    }
}
