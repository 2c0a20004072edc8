package com.tradeintel.common.model;

import com.fasterxml.jackson.annotation.JsonProperty;

import java.util.List;

/** Point-lookup answer for a single symbol. */
public record SymbolIntelligence(
    @JsonProperty("profile")         SymbolProfile      profile,
    @JsonProperty("recentTrades")    List<TradeOutcome> recentTrades,
    @JsonProperty("catalysts")       List<CatalystStat> catalysts,
    @JsonProperty("bestCatalyst")    CatalystStat       bestCatalyst,
    @JsonProperty("worstCatalyst")   CatalystStat       worstCatalyst,
    @JsonProperty("recommendations") List<String>       recommendations
) {}
