package com.tradeintel.common.model;

import com.fasterxml.jackson.annotation.JsonProperty;

public record PlatformTotals(
    @JsonProperty("totalIdeas")       int    totalIdeas,
    @JsonProperty("closedIdeas")      int    closedIdeas,
    @JsonProperty("wins")             int    wins,
    @JsonProperty("losses")           int    losses,
    @JsonProperty("breakevens")       int    breakevens,
    @JsonProperty("winRate")          Double winRate,
    @JsonProperty("totalPnl")         Double totalPnl,
    @JsonProperty("avgReturnPercent") Double avgReturnPercent,
    @JsonProperty("profitFactor")     Double profitFactor
) {}
