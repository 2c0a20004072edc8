package com.tradeintel.common.narrative;

import com.tradeintel.common.health.HealthThresholds;
import com.tradeintel.common.model.CalibrationBin;
import com.tradeintel.common.model.CalibrationReport;
import com.tradeintel.common.model.CatalystStat;
import com.tradeintel.common.model.EngineMetrics;
import com.tradeintel.common.model.HealthStatus;
import com.tradeintel.common.model.PlatformHealth;
import com.tradeintel.common.model.SymbolProfile;
import com.tradeintel.common.model.TradeDirection;

import java.util.ArrayList;
import java.util.List;
import java.util.Locale;

/**
 * Threshold-based advisory text. Every rule reads a numeric field and emits at most one line;
 * rules run in a fixed order.
 */
public class RuleBasedNarrativeGenerator implements NarrativeGenerator {

    // Calibration
    static final double BRIER_HIGH_PRIORITY     = 0.20;
    static final double BRIER_MODERATE          = 0.15;
    static final double OVERCONFIDENT_GAP       = 15.0;
    static final double UNDERCONFIDENT_GAP      = 10.0;
    static final int    SPARSE_BIN_SAMPLES      = 10;
    static final int    MAX_SPARSE_BINS         = 2;
    static final int    ADJUSTABLE_BIN_SAMPLES  = 10;

    // Symbols
    static final int    MIN_SYMBOL_TRADES       = 5;
    static final int    MIN_CATALYST_TRADES     = 3;
    static final double HIGH_PERFORMER_WIN_RATE = 70.0;
    static final double LOW_WIN_RATE            = 40.0;
    static final double DIRECTION_GAP           = 20.0;
    static final double GOOD_CATALYST_WIN_RATE  = 60.0;
    static final double STRONG_PROFIT_FACTOR    = 2.0;

    private final HealthThresholds thresholds;

    public RuleBasedNarrativeGenerator() {
        this(HealthThresholds.DEFAULTS);
    }

    public RuleBasedNarrativeGenerator(HealthThresholds thresholds) {
        this.thresholds = thresholds;
    }

    // ── calibration ──────────────────────────────────────────────────────────

    @Override
    public List<String> calibrationRecommendations(CalibrationReport report) {
        List<String> out = new ArrayList<>();
        if (report.totalSamples() == 0) {
            out.add("No closed trades with confidence scores yet; calibration cannot be assessed.");
            return List.copyOf(out);
        }

        Double brier = report.brierScore();
        if (brier != null && brier > BRIER_HIGH_PRIORITY) {
            out.add(fmt("High priority: Brier score %.3f shows poor probability estimates; review how confidence is scored.", brier));
        } else if (brier != null && brier > BRIER_MODERATE) {
            out.add(fmt("Moderate: Brier score %.3f leaves room to sharpen confidence estimates.", brier));
        }

        for (CalibrationBin bin : report.bins()) {
            Double gap = bin.gap();
            if (gap == null || !bin.eligible()) continue;
            if (gap > OVERCONFIDENT_GAP) {
                out.add(fmt("%s band is overconfident by %.1f points (predicted %.1f%%, actual %.1f%%).",
                            bin.label(), gap, bin.predictedConfidence(), bin.actualWinRate()));
            } else if (-gap > UNDERCONFIDENT_GAP) {
                out.add(fmt("%s band is underconfident by %.1f points (predicted %.1f%%, actual %.1f%%).",
                            bin.label(), -gap, bin.predictedConfidence(), bin.actualWinRate()));
            }
        }

        long sparse = report.bins().stream()
            .filter(b -> b.sampleSize() > 0 && b.sampleSize() < SPARSE_BIN_SAMPLES)
            .count();
        if (sparse > MAX_SPARSE_BINS) {
            out.add(fmt("%d confidence bins have fewer than %d samples; collect more outcomes before trusting them.",
                        sparse, SPARSE_BIN_SAMPLES));
        }

        for (CalibrationBin bin : report.bins()) {
            if (bin.sampleSize() < ADJUSTABLE_BIN_SAMPLES || Boolean.TRUE.equals(bin.calibrated())) continue;
            double gap = bin.gap();
            out.add(fmt("Adjust %s confidence %s by %.0f points.",
                        bin.label(), gap > 0 ? "down" : "up", Math.abs(gap)));
        }

        if (out.isEmpty()) {
            out.add("Calibration looks good: predicted confidence tracks realized win rates.");
        }
        return List.copyOf(out);
    }

    // ── platform health ──────────────────────────────────────────────────────

    @Override
    public List<String> healthIssues(PlatformHealth health, List<EngineMetrics> engines) {
        List<String> out = new ArrayList<>();
        if (health.closedTrades() == 0) {
            out.add("No closed trades in the ledger yet.");
            return List.copyOf(out);
        }
        Double expectancy = health.aggregateExpectancy();
        Double pf = health.aggregateProfitFactor();
        if (expectancy != null && expectancy <= 0.0) {
            out.add(fmt("Aggregate expectancy is %.2f%% per trade.", expectancy));
        }
        if (pf != null && pf < thresholds.unhealthyMaxProfitFactor()) {
            out.add(fmt("Profit factor %.2f: gross losses exceed gross gains.", pf));
        } else if (pf != null && pf < thresholds.healthyMinProfitFactor()) {
            out.add(fmt("Profit factor %.2f is below the healthy level of %.2f.", pf, thresholds.healthyMinProfitFactor()));
        }
        if (health.closedTrades() < thresholds.minTrades()) {
            out.add(fmt("Only %d closed trades; statistics are not yet reliable.", health.closedTrades()));
        }
        for (EngineMetrics e : engines) {
            if (!health.unhealthyEngines().contains(e.key())) continue;
            out.add(fmt("Engine %s is losing: expectancy %.2f%%, profit factor %s.",
                        e.key(), e.expectancy(), ratio(e.profitFactor())));
        }
        return List.copyOf(out);
    }

    @Override
    public List<String> healthRecommendations(PlatformHealth health, List<EngineMetrics> engines) {
        List<String> out = new ArrayList<>();
        if (health.closedTrades() == 0) {
            out.add("Record resolved trades to enable performance tracking.");
            return List.copyOf(out);
        }
        for (String engine : health.unhealthyEngines()) {
            out.add(fmt("Reduce reliance on %s until its expectancy turns positive.", engine));
        }
        Double pf = health.aggregateProfitFactor();
        if (pf != null && pf < thresholds.healthyMinProfitFactor()) {
            out.add("Tighten stops or raise entry criteria to lift the profit factor.");
        }
        Double winRate = health.aggregateWinRate();
        if (winRate != null && winRate < LOW_WIN_RATE) {
            out.add(fmt("Win rate %.1f%% is low; check that winners are large enough to carry the losers.", winRate));
        }
        if (health.closedTrades() < thresholds.minTrades()) {
            out.add("Keep collecting outcomes before acting on these statistics.");
        }
        if (out.isEmpty() && health.status() == HealthStatus.HEALTHY) {
            out.add("Performance is within healthy bounds; no action needed.");
        }
        return List.copyOf(out);
    }

    // ── symbols ──────────────────────────────────────────────────────────────

    @Override
    public List<String> symbolRecommendations(SymbolProfile p, List<CatalystStat> catalysts) {
        List<String> out = new ArrayList<>();
        if (p.closedTrades() == 0) {
            out.add(fmt("No closed trades for %s yet.", p.symbol()));
            return List.copyOf(out);
        }
        if (p.closedTrades() >= MIN_SYMBOL_TRADES) {
            if (p.overallWinRate() >= HIGH_PERFORMER_WIN_RATE) {
                out.add(fmt("High performer: %s wins %.0f%% of %d trades.", p.symbol(), p.overallWinRate(), p.closedTrades()));
            } else if (p.overallWinRate() < LOW_WIN_RATE) {
                out.add(fmt("Caution: %s wins only %.0f%% of %d trades.", p.symbol(), p.overallWinRate(), p.closedTrades()));
            }
        }
        if (p.longWinRate() != null && p.shortWinRate() != null) {
            double gap = p.longWinRate() - p.shortWinRate();
            if (gap > DIRECTION_GAP) {
                out.add(fmt("Favor long ideas on %s: %.0f%% long vs %.0f%% short win rate.",
                            p.symbol(), p.longWinRate(), p.shortWinRate()));
            } else if (-gap > DIRECTION_GAP) {
                out.add(fmt("Favor short ideas on %s: %.0f%% short vs %.0f%% long win rate.",
                            p.symbol(), p.shortWinRate(), p.longWinRate()));
            }
        }
        if (p.bestCatalyst() != null && p.bestCatalystWinRate() >= GOOD_CATALYST_WIN_RATE) {
            out.add(fmt("Best catalyst for %s is %s at %.0f%% win rate.",
                        p.symbol(), p.bestCatalyst(), p.bestCatalystWinRate()));
        }
        for (CatalystStat c : catalysts) {
            if (c.direction() == null || c.trades() < MIN_CATALYST_TRADES || c.winRate() >= LOW_WIN_RATE) continue;
            String side = c.direction() == TradeDirection.SHORT ? "shorting" : "going long on";
            out.add(fmt("Avoid %s %s on %s catalysts: %.0f%% win rate over %d trades.",
                        side, p.symbol(), c.catalystType(), c.winRate(), c.trades()));
        }
        if (p.profitFactor() != null && p.profitFactor() >= STRONG_PROFIT_FACTOR) {
            out.add(fmt("Profit factor %s on %s: winners outweigh losers.", ratio(p.profitFactor()), p.symbol()));
        }
        return List.copyOf(out);
    }

    private static String ratio(Double value) {
        if (value == null) return "n/a";
        if (value.isInfinite()) return value > 0 ? "∞" : "-∞";
        return fmt("%.2f", value);
    }

    private static String fmt(String pattern, Object... args) {
        return String.format(Locale.ROOT, pattern, args);
    }
}
