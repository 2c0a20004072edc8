package com.tradeintel.intelligence.config;

/**
 * @param breakevenBand  |return| at or below this (percent) resolves as BREAKEVEN
 * @param recentLimit    default row count for the recent-outcomes endpoint
 */
public record LedgerSettings(double breakevenBand, int recentLimit) {

    public LedgerSettings {
        if (breakevenBand < 0.0 || Double.isNaN(breakevenBand)) {
            throw new IllegalArgumentException("breakevenBand must be >= 0, got " + breakevenBand);
        }
    }
}
