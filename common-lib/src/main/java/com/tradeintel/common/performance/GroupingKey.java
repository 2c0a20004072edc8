package com.tradeintel.common.performance;

import com.tradeintel.common.model.TradeOutcome;

import java.util.function.Function;

/** Ledger dimensions the aggregator can group by. */
public enum GroupingKey {

    ENGINE(TradeOutcome::engine),
    SYMBOL(TradeOutcome::symbol),
    DIRECTION(t -> t.direction() == null ? null : t.direction().name()),
    CATALYST(TradeOutcome::catalystType),
    ASSET_TYPE(TradeOutcome::assetType);

    private final Function<TradeOutcome, String> extractor;

    GroupingKey(Function<TradeOutcome, String> extractor) {
        this.extractor = extractor;
    }

    /** @return the group value for {@code outcome}, or null when the row lacks this field */
    public String keyOf(TradeOutcome outcome) {
        String key = extractor.apply(outcome);
        return key == null || key.isBlank() ? null : key;
    }

    /** Parses a request parameter such as {@code engine}, {@code asset-type} or {@code ASSET_TYPE}. */
    public static GroupingKey fromParam(String value) {
        if (value == null || value.isBlank()) return ENGINE;
        String normalized = value.trim().toUpperCase().replace('-', '_');
        for (GroupingKey key : values()) {
            if (key.name().equals(normalized)) return key;
        }
        throw new IllegalArgumentException("Unknown grouping key: " + value);
    }
}
