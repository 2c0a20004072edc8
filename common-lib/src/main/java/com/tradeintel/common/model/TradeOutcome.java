package com.tradeintel.common.model;

import com.fasterxml.jackson.annotation.JsonIgnore;
import com.fasterxml.jackson.annotation.JsonProperty;

import java.time.Instant;
import java.util.Collection;
import java.util.Comparator;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Set;

/**
 * One row of the outcome ledger: a trade prediction together with its realized result.
 *
 * <p>Optional fields ({@code engine}, {@code assetType}, {@code direction},
 * {@code confidenceScore}, {@code catalystType}) may be {@code null}. A row missing one of
 * them is skipped only by the aggregations that need that field. A confidence outside
 * [0, 100] is treated the same as a missing one.
 *
 * <p>{@code signals} is normalised on construction: trimmed, blank tags removed and
 * duplicates collapsed, so a trade counts once per signal.
 */
public record TradeOutcome(
    @JsonProperty("id")              Long              id,
    @JsonProperty("symbol")          String            symbol,
    @JsonProperty("engine")          String            engine,
    @JsonProperty("assetType")       String            assetType,
    @JsonProperty("direction")       TradeDirection    direction,
    @JsonProperty("signals")         List<String>      signals,
    @JsonProperty("confidenceScore") Double            confidenceScore,
    @JsonProperty("catalystType")    String            catalystType,
    @JsonProperty("returnPercent")   Double            returnPercent,
    @JsonProperty("realizedPnl")     Double            realizedPnl,
    @JsonProperty("resolution")      OutcomeResolution resolution,
    @JsonProperty("openedAt")        Instant           openedAt,
    @JsonProperty("closedAt")        Instant           closedAt
) {

    /**
     * Canonical ledger order: close time, then open time, then id. Rows without timestamps sort last.
     * Used for the drawdown walk and to make every reduction independent of input order.
     */
    public static final Comparator<TradeOutcome> CHRONOLOGICAL =
        Comparator.comparing(TradeOutcome::closedAt, Comparator.nullsLast(Comparator.naturalOrder()))
            .thenComparing(TradeOutcome::openedAt, Comparator.nullsLast(Comparator.naturalOrder()))
            .thenComparing(TradeOutcome::id, Comparator.nullsLast(Comparator.naturalOrder()))
            .thenComparing(TradeOutcome::symbol, Comparator.nullsLast(Comparator.naturalOrder()))
            .thenComparing(TradeOutcome::returnPercent, Comparator.nullsLast(Comparator.naturalOrder()));

    public TradeOutcome {
        signals = normalizeSignals(signals);
    }

    @JsonIgnore
    public boolean isClosed() {
        return resolution != null && resolution.isClosed();
    }

    @JsonIgnore
    public boolean isWin() {
        return resolution == OutcomeResolution.WIN;
    }

    @JsonIgnore
    public boolean isLoss() {
        return resolution == OutcomeResolution.LOSS;
    }

    /** True when the confidence is present and within [0, 100]. */
    @JsonIgnore
    public boolean hasUsableConfidence() {
        return confidenceScore != null && !confidenceScore.isNaN()
            && confidenceScore >= 0.0 && confidenceScore <= 100.0;
    }

    /** Latest known timestamp of the idea: close time if resolved, otherwise open time. */
    @JsonIgnore
    public Instant lastActivity() {
        return closedAt != null ? closedAt : openedAt;
    }

    private static List<String> normalizeSignals(Collection<String> raw) {
        if (raw == null || raw.isEmpty()) return List.of();
        Set<String> distinct = new LinkedHashSet<>();
        for (String s : raw) {
            if (s != null && !s.isBlank()) distinct.add(s.trim());
        }
        return List.copyOf(distinct);
    }
}
