package com.tradeintel.common.model;

import com.fasterxml.jackson.annotation.JsonProperty;

/**
 * Closed-trade statistics for one catalyst type of one symbol. {@code direction} is
 * {@code null} for the row combining both sides.
 */
public record CatalystStat(
    @JsonProperty("catalystType") String         catalystType,
    @JsonProperty("direction")    TradeDirection direction,
    @JsonProperty("trades")       int            trades,
    @JsonProperty("wins")         int            wins,
    @JsonProperty("losses")       int            losses,
    @JsonProperty("winRate")      Double         winRate,
    @JsonProperty("avgReturn")    Double         avgReturn,
    @JsonProperty("totalPnl")     Double         totalPnl
) {}
