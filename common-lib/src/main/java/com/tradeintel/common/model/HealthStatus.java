package com.tradeintel.common.model;

import com.fasterxml.jackson.annotation.JsonValue;

public enum HealthStatus {

    HEALTHY,
    DEGRADED,
    UNHEALTHY;

    @JsonValue
    public String label() {
        return name().toLowerCase();
    }
}
