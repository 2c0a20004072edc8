package com.tradeintel.intelligence.dto;

import com.fasterxml.jackson.annotation.JsonProperty;

import java.time.Instant;
import java.util.List;

/**
 * Ledger write. {@code resolution} may be omitted: it is derived from {@code returnPercent}
 * (or OPEN when no return is given). {@code catalyst} is free text classified by keyword
 * when {@code catalystType} is absent.
 */
public record RecordOutcomeRequest(
    @JsonProperty("symbol")          String       symbol,
    @JsonProperty("engine")          String       engine,
    @JsonProperty("assetType")       String       assetType,
    @JsonProperty("direction")       String       direction,
    @JsonProperty("signals")         List<String> signals,
    @JsonProperty("confidenceScore") Double       confidenceScore,
    @JsonProperty("catalystType")    String       catalystType,
    @JsonProperty("catalyst")        String       catalyst,
    @JsonProperty("returnPercent")   Double       returnPercent,
    @JsonProperty("realizedPnl")     Double       realizedPnl,
    @JsonProperty("resolution")      String       resolution,
    @JsonProperty("openedAt")        Instant      openedAt,
    @JsonProperty("closedAt")        Instant      closedAt
) {}
