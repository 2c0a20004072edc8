package com.tradeintel.common.model;

import com.fasterxml.jackson.annotation.JsonProperty;

/** One row of a platform-wide breakdown (by source, asset type, direction or catalyst). */
public record BreakdownRow(
    @JsonProperty("key")       String key,
    @JsonProperty("ideas")     int    ideas,
    @JsonProperty("closed")    int    closed,
    @JsonProperty("wins")      int    wins,
    @JsonProperty("losses")    int    losses,
    @JsonProperty("winRate")   Double winRate,
    @JsonProperty("avgReturn") Double avgReturn,
    @JsonProperty("totalPnl")  Double totalPnl
) {}
