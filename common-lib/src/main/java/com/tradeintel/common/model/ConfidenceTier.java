package com.tradeintel.common.model;

import com.fasterxml.jackson.annotation.JsonValue;

/** Sample-size label telling the reader how far a signal's statistics can be trusted. */
public enum ConfidenceTier {

    UNTESTED,
    LOW,
    MEDIUM,
    HIGH;

    @JsonValue
    public String label() {
        return name().toLowerCase();
    }
}
