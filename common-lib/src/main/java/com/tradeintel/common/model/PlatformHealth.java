package com.tradeintel.common.model;

import com.fasterxml.jackson.annotation.JsonProperty;

import java.util.List;

/**
 * Platform health verdict. The numeric part comes from the health evaluator; issue and
 * recommendation text is attached by a narrative generator.
 */
public record PlatformHealth(
    @JsonProperty("status")                HealthStatus status,
    @JsonProperty("closedTrades")          int          closedTrades,
    @JsonProperty("aggregateExpectancy")   Double       aggregateExpectancy,
    @JsonProperty("aggregateProfitFactor") Double       aggregateProfitFactor,
    @JsonProperty("aggregateWinRate")      Double       aggregateWinRate,
    @JsonProperty("unhealthyEngines")      List<String> unhealthyEngines,
    @JsonProperty("issues")                List<String> issues,
    @JsonProperty("recommendations")       List<String> recommendations
) {

    public PlatformHealth withNarrative(List<String> issueText, List<String> advice) {
        return new PlatformHealth(status, closedTrades, aggregateExpectancy, aggregateProfitFactor,
                                  aggregateWinRate, unhealthyEngines, List.copyOf(issueText), List.copyOf(advice));
    }
}
