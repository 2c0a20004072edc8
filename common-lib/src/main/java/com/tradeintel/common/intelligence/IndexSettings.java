package com.tradeintel.common.intelligence;

/**
 * @param minCatalystSamples   closed trades a catalyst needs before it can be best or worst
 * @param recentTrades         trades returned with a symbol lookup
 * @param minPerformerTrades   closed trades a symbol needs to appear in top/worst performers
 * @param performerLimit       size of the top/worst performer lists
 * @param minAdjustmentTrades  closed trades a symbol needs before it adjusts new ideas
 */
public record IndexSettings(
    int minCatalystSamples,
    int recentTrades,
    int minPerformerTrades,
    int performerLimit,
    int minAdjustmentTrades
) {

    public static final IndexSettings DEFAULTS = new IndexSettings(3, 10, 3, 10, 5);

    public IndexSettings {
        if (minCatalystSamples < 1 || recentTrades < 0 || minPerformerTrades < 1
                || performerLimit < 1 || minAdjustmentTrades < 1) {
            throw new IllegalArgumentException("index settings must be positive");
        }
    }
}
