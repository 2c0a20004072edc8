package com.tradeintel.common.model;

import com.fasterxml.jackson.annotation.JsonProperty;

import java.util.List;

/**
 * Platform-wide historical statistics. {@code byCatalyst} is ordered by win rate descending,
 * {@code symbolLeaderboard} by idea count descending. Performer lists only include symbols
 * with enough closed trades to rank.
 */
public record PlatformStats(
    @JsonProperty("overall")           PlatformTotals          overall,
    @JsonProperty("bySource")          List<BreakdownRow>      bySource,
    @JsonProperty("byAssetType")       List<BreakdownRow>      byAssetType,
    @JsonProperty("byDirection")       List<BreakdownRow>      byDirection,
    @JsonProperty("byCatalyst")        List<BreakdownRow>      byCatalyst,
    @JsonProperty("symbolLeaderboard") List<SymbolProfile>     symbolLeaderboard,
    @JsonProperty("confidenceBands")   List<ConfidenceBandRow> confidenceBands,
    @JsonProperty("topPerformers")     List<SymbolProfile>     topPerformers,
    @JsonProperty("worstPerformers")   List<SymbolProfile>     worstPerformers
) {}
