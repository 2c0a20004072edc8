package com.tradeintel.common.model;

import com.fasterxml.jackson.annotation.JsonProperty;

import java.util.List;

/**
 * Dashboard view of the signal weight table. Boosted/reduced/neutral are counted on the
 * effective weight; {@code enabled} tells whether dynamic weighting is applied upstream.
 */
public record SignalWeightSummary(
    @JsonProperty("enabled")       boolean            enabled,
    @JsonProperty("totalSignals")  int                totalSignals,
    @JsonProperty("boosted")       int                boosted,
    @JsonProperty("reduced")       int                reduced,
    @JsonProperty("neutral")       int                neutral,
    @JsonProperty("overridden")    int                overridden,
    @JsonProperty("topBoosted")    List<SignalWeight> topBoosted,
    @JsonProperty("topReduced")    List<SignalWeight> topReduced,
    @JsonProperty("signals")       List<SignalWeight> signals
) {}
