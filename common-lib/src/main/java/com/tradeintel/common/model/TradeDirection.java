package com.tradeintel.common.model;

/**
 * Side of a resolved trade idea.
 *
 * <ul>
 *   <li>LONG : profits when price rises (calls, long stock)</li>
 *   <li>SHORT: profits when price falls (puts, short stock)</li>
 * </ul>
 */
public enum TradeDirection {

    LONG,
    SHORT;

    /** Lenient parse used by the ledger mapper; unknown or blank values map to {@code null}. */
    public static TradeDirection fromString(String value) {
        if (value == null || value.isBlank()) return null;
        return switch (value.trim().toUpperCase()) {
            case "LONG", "BUY", "CALL"  -> LONG;
            case "SHORT", "SELL", "PUT" -> SHORT;
            default -> null;
        };
    }
}
