package com.tradeintel.common.calibration;

import com.tradeintel.common.model.ConfidenceBandRow;
import com.tradeintel.common.model.TradeOutcome;
import com.tradeintel.common.performance.ReturnStatistics;

import java.util.ArrayList;
import java.util.List;

/**
 * Coarse platform-wide calibration table with fixed bands 0-60, 60-70, 70-80, 80-90, 90-100.
 * Only closed ideas with a confidence in [0, 100] are counted, so {@code ideaCount} is the
 * denominator of the actual win rate.
 */
public final class ConfidenceBandTable {

    static final double[] BAND_EDGES = {0.0, 60.0, 70.0, 80.0, 90.0, 100.0};

    private ConfidenceBandTable() {}

    public static List<ConfidenceBandRow> build(List<TradeOutcome> outcomes) {
        int bands = BAND_EDGES.length - 1;
        int[] ideas = new int[bands];
        int[] closed = new int[bands];
        int[] wins = new int[bands];

        for (TradeOutcome t : outcomes) {
            if (!t.isClosed() || !t.hasUsableConfidence()) continue;
            int b = bandOf(t.confidenceScore());
            ideas[b]++;
            closed[b]++;
            if (t.isWin()) wins[b]++;
        }

        List<ConfidenceBandRow> rows = new ArrayList<>(bands);
        for (int b = 0; b < bands; b++) {
            double lower = BAND_EDGES[b];
            double upper = BAND_EDGES[b + 1];
            double expected = (lower + upper) / 2.0;
            Double actual = ReturnStatistics.rate(wins[b], closed[b]);
            rows.add(new ConfidenceBandRow(
                (long) lower + "-" + (long) upper,
                ideas[b], closed[b], wins[b], expected, actual,
                actual == null ? null : actual - expected));
        }
        return List.copyOf(rows);
    }

    static int bandOf(double confidence) {
        for (int b = BAND_EDGES.length - 2; b > 0; b--) {
            if (confidence >= BAND_EDGES[b]) return b;
        }
        return 0;
    }
}
