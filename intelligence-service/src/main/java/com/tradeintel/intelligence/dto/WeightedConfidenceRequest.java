package com.tradeintel.intelligence.dto;

import com.fasterxml.jackson.annotation.JsonProperty;

import java.util.List;

public record WeightedConfidenceRequest(
    @JsonProperty("signals")        List<String> signals,
    @JsonProperty("baseConfidence") double       baseConfidence
) {}
