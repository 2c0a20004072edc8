package com.tradeintel.common.model;

import com.fasterxml.jackson.annotation.JsonProperty;

/**
 * Platform-wide calibration row for a coarse confidence band. Expected win rate is the band
 * midpoint; {@code calibrationError = actual − expected} (negative means overconfident).
 */
public record ConfidenceBandRow(
    @JsonProperty("band")             String label,
    @JsonProperty("ideaCount")        int    ideaCount,
    @JsonProperty("closedCount")      int    closedCount,
    @JsonProperty("wins")             int    wins,
    @JsonProperty("expectedWinRate")  double expectedWinRate,
    @JsonProperty("actualWinRate")    Double actualWinRate,
    @JsonProperty("calibrationError") Double calibrationError
) {}
