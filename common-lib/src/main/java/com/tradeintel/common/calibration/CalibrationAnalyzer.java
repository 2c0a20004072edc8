package com.tradeintel.common.calibration;

import com.tradeintel.common.model.CalibrationBin;
import com.tradeintel.common.model.CalibrationReport;
import com.tradeintel.common.model.TradeOutcome;
import com.tradeintel.common.performance.ReturnStatistics;

import java.util.ArrayList;
import java.util.List;
import java.util.Locale;

/**
 * Buckets closed predictions by their confidence score and compares predicted confidence to
 * realized win rate.
 *
 * <pre>
 *   bin index    = min(floor(confidence / width), binCount − 1)     (100 lands in the last bin)
 *   actual       = wins / members × 100                              (breakevens count as members)
 *   Brier        = mean((confidence/100 − outcome)²) over wins and losses only
 *   ECE          = Σ n_b·|predicted_b − actual_b| / Σ n_b            over bins with n_b ≥ minBinSamples
 *   reliability  = clamp(100 − 2·ECE, 0, 100)
 * </pre>
 *
 * Rows without a confidence score, or with one outside [0, 100], are skipped and counted in {@code excludedRecords}.
 * Recommendations are left empty; they belong to the narrative layer.
 */
public final class CalibrationAnalyzer {

    static final double RELIABILITY_SLOPE = 2.0;

    private CalibrationAnalyzer() {}

    public static CalibrationReport analyze(List<TradeOutcome> outcomes, CalibrationSettings settings) {
        int binCount = settings.binCount();
        int[] members = new int[binCount];
        int[] wins = new int[binCount];
        int[] losses = new int[binCount];
        double[] confidenceSum = new double[binCount];

        int excluded = 0;
        int totalSamples = 0;
        int totalWins = 0;
        int brierCount = 0;
        double brierSum = 0.0;

        List<TradeOutcome> ordered = outcomes.stream()
            .filter(TradeOutcome::isClosed)
            .sorted(TradeOutcome.CHRONOLOGICAL)
            .toList();

        for (TradeOutcome t : ordered) {
            if (!t.hasUsableConfidence()) {
                excluded++;
                continue;
            }
            double confidence = t.confidenceScore();
            int idx = binIndex(confidence, settings.binWidth(), binCount);
            members[idx]++;
            confidenceSum[idx] += confidence;
            totalSamples++;
            if (t.isWin()) {
                wins[idx]++;
                totalWins++;
            } else if (t.isLoss()) {
                losses[idx]++;
            }
            if (t.isWin() || t.isLoss()) {
                double p = confidence / 100.0;
                double o = t.isWin() ? 1.0 : 0.0;
                brierSum += (p - o) * (p - o);
                brierCount++;
            }
        }

        List<CalibrationBin> bins = new ArrayList<>(binCount);
        double weightedGap = 0.0;
        int eligibleSamples = 0;
        Double mce = null;

        for (int i = 0; i < binCount; i++) {
            double lower = i * settings.binWidth();
            double upper = Math.min(100.0, (i + 1) * settings.binWidth());
            int n = members[i];
            boolean eligible = n >= settings.minBinSamples();
            Double predicted = n == 0 ? null : confidenceSum[i] / n;
            Double actual = ReturnStatistics.rate(wins[i], n);
            Double stdErr = null;
            Boolean calibrated = null;
            if (n > 0) {
                double p = actual / 100.0;
                stdErr = Math.sqrt(p * (1.0 - p) / n) * 100.0;
                double gap = Math.abs(predicted - actual);
                calibrated = gap <= settings.tolerance();
                if (eligible) {
                    weightedGap += n * gap;
                    eligibleSamples += n;
                    mce = mce == null ? gap : Math.max(mce, gap);
                }
            }
            bins.add(new CalibrationBin(label(lower, upper), lower, upper, predicted, actual, n,
                                        wins[i], losses[i], stdErr, calibrated, eligible));
        }

        Double ece = eligibleSamples == 0 ? null : weightedGap / eligibleSamples;
        Double reliability = ece == null
            ? null
            : ReturnStatistics.clamp(100.0 - RELIABILITY_SLOPE * ece, 0.0, 100.0);
        Double brier = brierCount == 0 ? null : brierSum / brierCount;

        return new CalibrationReport(List.copyOf(bins), totalSamples, excluded,
                                     ReturnStatistics.rate(totalWins, totalSamples),
                                     brier, ece, mce, reliability, List.of());
    }

    static int binIndex(double confidence, double width, int binCount) {
        int idx = (int) Math.floor(confidence / width);
        return Math.max(0, Math.min(idx, binCount - 1));
    }

    private static String label(double lower, double upper) {
        return String.format(Locale.ROOT, "%s-%s%%", trim(lower), trim(upper));
    }

    private static String trim(double v) {
        return v == Math.rint(v) ? Long.toString((long) v) : Double.toString(v);
    }
}
