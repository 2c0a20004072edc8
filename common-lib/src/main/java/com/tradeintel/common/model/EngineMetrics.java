package com.tradeintel.common.model;

import com.fasterxml.jackson.annotation.JsonProperty;

/**
 * Performance statistics of one group of closed trades (an engine, a symbol, a direction,
 * a catalyst type or an asset type, depending on the grouping key).
 *
 * <p>All percentages are plain numbers (57.3 means 57.3%). Ratios that divide by zero carry
 * {@link Double#POSITIVE_INFINITY} (or negative infinity for a zero-variance losing Sharpe).
 * Statistics that cannot be computed from the sample are {@code null}, never zero.
 *
 * <ul>
 *   <li>{@code expectancy}    – mean realized return per closed trade (%)</li>
 *   <li>{@code sharpeRatio}   – mean / population stdev of returns; null below 2 trades</li>
 *   <li>{@code profitFactor}  – gross gain / gross loss</li>
 *   <li>{@code maxDrawdown}   – largest peak-to-trough fall of the cumulative return curve (points)</li>
 *   <li>{@code avgLossPercent} – reported as a positive magnitude</li>
 * </ul>
 */
public record EngineMetrics(
    @JsonProperty("key")                String key,
    @JsonProperty("tradeCount")         int    tradeCount,
    @JsonProperty("wins")               int    wins,
    @JsonProperty("losses")             int    losses,
    @JsonProperty("breakevens")         int    breakevens,
    @JsonProperty("winRate")            Double winRate,
    @JsonProperty("expectancy")         Double expectancy,
    @JsonProperty("sharpeRatio")        Double sharpeRatio,
    @JsonProperty("profitFactor")       Double profitFactor,
    @JsonProperty("maxDrawdown")        Double maxDrawdown,
    @JsonProperty("avgWinPercent")      Double avgWinPercent,
    @JsonProperty("avgLossPercent")     Double avgLossPercent,
    @JsonProperty("totalReturnPercent") Double totalReturnPercent,
    @JsonProperty("avgConfidence")      Double avgConfidence
) {}
