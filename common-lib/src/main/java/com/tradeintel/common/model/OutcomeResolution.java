package com.tradeintel.common.model;

import java.util.Locale;

/**
 * Resolution of a trade idea. {@code OPEN} rows are ideas that have not resolved yet;
 * they count as ideas but never contribute to any statistic.
 */
public enum OutcomeResolution {

    WIN,
    LOSS,
    BREAKEVEN,
    OPEN;

    public boolean isClosed() {
        return this != OPEN;
    }

    /**
     * Classifies a realized return against the breakeven band.
     *
     * <pre>
     *   |r| &lt;= band  → BREAKEVEN
     *   r  &gt;  band   → WIN
     *   r  &lt; −band   → LOSS
     * </pre>
     *
     * @param returnPercent realized return in percent
     * @param breakevenBand half-width of the breakeven band in percent (≥ 0)
     */
    public static OutcomeResolution classify(double returnPercent, double breakevenBand) {
        if (Math.abs(returnPercent) <= breakevenBand) return BREAKEVEN;
        return returnPercent > 0 ? WIN : LOSS;
    }

    /** Lenient parse; {@code null} when the value is absent or unrecognised. */
    public static OutcomeResolution fromString(String value) {
        if (value == null || value.isBlank()) return null;
        return switch (normalize(value)) {
            case "WIN", "WON", "HIT_TARGET"       -> WIN;
            case "LOSS", "LOST", "HIT_STOP"       -> LOSS;
            case "BREAKEVEN", "BREAK_EVEN", "FLAT" -> BREAKEVEN;
            case "OPEN", "PENDING"                -> OPEN;
            default -> null;
        };
    }

    /**
     * Closing statuses that say how an idea ended but not whether it won, such as
     * {@code expired} or {@code manual_exit}. Their resolution comes from the realized return.
     */
    public static boolean isDerivedFromReturn(String value) {
        if (value == null || value.isBlank()) return false;
        return switch (normalize(value)) {
            case "EXPIRED", "MANUAL_EXIT" -> true;
            default -> false;
        };
    }

    private static String normalize(String value) {
        return value.trim().toUpperCase(Locale.ROOT).replace('-', '_').replace(' ', '_');
    }
}
