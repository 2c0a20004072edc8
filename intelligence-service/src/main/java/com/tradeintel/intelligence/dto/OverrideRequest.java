package com.tradeintel.intelligence.dto;

import com.fasterxml.jackson.annotation.JsonProperty;

public record OverrideRequest(
    @JsonProperty("weight") Double weight,
    @JsonProperty("reason") String reason
) {}
