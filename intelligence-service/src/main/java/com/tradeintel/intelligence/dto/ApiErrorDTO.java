package com.tradeintel.intelligence.dto;

import com.fasterxml.jackson.annotation.JsonProperty;

public record ApiErrorDTO(
    @JsonProperty("errorKind") String errorKind,
    @JsonProperty("message")   String message
) {}
