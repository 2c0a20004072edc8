package com.tradeintel.common.model;

import com.fasterxml.jackson.annotation.JsonProperty;

import java.util.List;

/** Result of applying signal weights to a prospective idea's base confidence. */
public record WeightedConfidence(
    @JsonProperty("baseConfidence")     double       baseConfidence,
    @JsonProperty("adjustedConfidence") double       adjustedConfidence,
    @JsonProperty("averageWeight")      double       averageWeight,
    @JsonProperty("multiplier")         double       multiplier,
    @JsonProperty("knownSignals")       List<String> knownSignals,
    @JsonProperty("unknownSignals")     List<String> unknownSignals,
    @JsonProperty("enabled")            boolean      enabled
) {}
