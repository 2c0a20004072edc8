package com.tradeintel.common.model;

import com.fasterxml.jackson.annotation.JsonProperty;

import java.util.List;

/**
 * Additive confidence adjustment (points) suggested for a new idea from the symbol's history.
 * {@code hasHistory} is false when the symbol lacks enough closed trades to say anything.
 */
public record ConfidenceAdjustment(
    @JsonProperty("symbol")       String         symbol,
    @JsonProperty("catalystType") String         catalystType,
    @JsonProperty("direction")    TradeDirection direction,
    @JsonProperty("adjustment")   double         adjustment,
    @JsonProperty("reasons")      List<String>   reasons,
    @JsonProperty("hasHistory")   boolean        hasHistory
) {}
