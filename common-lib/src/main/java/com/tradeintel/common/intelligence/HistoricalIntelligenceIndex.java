package com.tradeintel.common.intelligence;

import com.tradeintel.common.model.CatalystStat;
import com.tradeintel.common.model.ConfidenceAdjustment;
import com.tradeintel.common.model.PlatformStats;
import com.tradeintel.common.model.SymbolIntelligence;
import com.tradeintel.common.model.SymbolProfile;
import com.tradeintel.common.model.TradeDirection;
import com.tradeintel.common.model.TradeOutcome;
import com.tradeintel.common.narrative.NarrativeGenerator;

import java.util.ArrayList;
import java.util.Collections;
import java.util.Comparator;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Optional;
import java.util.TreeMap;

/**
 * Immutable symbol-keyed index over the ledger. Built in one pass by {@link #build}; the only
 * way to change it is to build a new one, which keeps every lookup consistent with a full
 * recompute.
 *
 * <p>Symbols are keyed upper-case. Looking up a symbol the ledger has never seen yields an
 * all-null profile rather than an error.
 */
public final class HistoricalIntelligenceIndex {

    // Confidence adjustment rules (points added to a new idea's confidence)
    static final double STRONG_SYMBOL_BONUS     = 10.0;
    static final double WEAK_SYMBOL_PENALTY     = -15.0;
    static final double DIRECTION_BIAS_STEP     = 5.0;
    static final double BEST_CATALYST_BONUS     = 8.0;
    static final double WORST_CATALYST_PENALTY  = -10.0;

    static final double STRONG_WIN_RATE         = 70.0;
    static final double WEAK_WIN_RATE           = 40.0;
    static final double DIRECTION_BIAS_GAP      = 15.0;
    static final double BEST_CATALYST_WIN_RATE  = 60.0;
    static final double WORST_CATALYST_WIN_RATE = 40.0;

    private static final Comparator<TradeOutcome> MOST_RECENT_FIRST =
        Comparator.comparing(TradeOutcome::lastActivity, Comparator.nullsLast(Comparator.reverseOrder()))
            .thenComparing(TradeOutcome::id, Comparator.nullsLast(Comparator.reverseOrder()));

    private record Entry(SymbolProfile profile, List<CatalystStat> catalysts, List<TradeOutcome> recent) {}

    private final Map<String, Entry> bySymbol;
    private final PlatformStats platformStats;
    private final IndexSettings settings;

    private HistoricalIntelligenceIndex(Map<String, Entry> bySymbol, PlatformStats platformStats,
                                        IndexSettings settings) {
        this.bySymbol = Collections.unmodifiableMap(bySymbol);
        this.platformStats = platformStats;
        this.settings = settings;
    }

    public static HistoricalIntelligenceIndex build(List<TradeOutcome> outcomes, IndexSettings settings) {
        Map<String, List<TradeOutcome>> rowsBySymbol = new TreeMap<>();
        for (TradeOutcome t : outcomes) {
            rowsBySymbol.computeIfAbsent(key(t.symbol()), k -> new ArrayList<>()).add(t);
        }
        Map<String, Entry> entries = new TreeMap<>();
        rowsBySymbol.forEach((symbol, rows) -> {
            rows.sort(TradeOutcome.CHRONOLOGICAL);
            SymbolProfile profile = SymbolProfileBuilder.build(symbol, rows, settings);
            List<CatalystStat> catalysts = SymbolProfileBuilder.catalystBreakdown(rows);
            List<TradeOutcome> recent = rows.stream()
                .sorted(MOST_RECENT_FIRST)
                .limit(settings.recentTrades())
                .toList();
            entries.put(symbol, new Entry(profile, catalysts, recent));
        });
        List<SymbolProfile> profiles = entries.values().stream().map(Entry::profile).toList();
        PlatformStats stats = PlatformStatsCalculator.compute(outcomes, profiles, settings);
        return new HistoricalIntelligenceIndex(entries, stats, settings);
    }

    public static HistoricalIntelligenceIndex empty(IndexSettings settings) {
        return build(List.of(), settings);
    }

    /** Number of symbol profiles held. */
    public int size() {
        return bySymbol.size();
    }

    public List<SymbolProfile> profiles() {
        return bySymbol.values().stream().map(Entry::profile).toList();
    }

    public Optional<SymbolProfile> profile(String symbol) {
        return Optional.ofNullable(bySymbol.get(key(symbol))).map(Entry::profile);
    }

    public List<CatalystStat> catalysts(String symbol) {
        Entry e = bySymbol.get(key(symbol));
        return e == null ? List.of() : e.catalysts();
    }

    public PlatformStats platformStats() {
        return platformStats;
    }

    /** Profile, recent trades, catalyst breakdown and generated recommendations for one symbol. */
    public SymbolIntelligence lookup(String symbol, NarrativeGenerator narrative) {
        String k = key(symbol);
        Entry e = bySymbol.get(k);
        if (e == null) {
            SymbolProfile empty = SymbolProfile.empty(k);
            return new SymbolIntelligence(empty, List.of(), List.of(), null, null,
                                          narrative.symbolRecommendations(empty, List.of()));
        }
        List<CatalystStat> combined = e.catalysts().stream().filter(c -> c.direction() == null).toList();
        CatalystStat best = SymbolProfileBuilder.bestCatalyst(combined, settings.minCatalystSamples()).orElse(null);
        CatalystStat worst = SymbolProfileBuilder.worstCatalyst(combined, settings.minCatalystSamples()).orElse(null);
        return new SymbolIntelligence(e.profile(), e.recent(), e.catalysts(), best, worst,
                                      narrative.symbolRecommendations(e.profile(), e.catalysts()));
    }

    /**
     * Suggests an additive confidence adjustment for a new idea on {@code symbol}.
     *
     * <pre>
     *   symbol win rate ≥ 70%                         → +10
     *   symbol win rate &lt; 40%                         → −15
     *   requested side beats the other by ≥ 15 points → +5 (trails by ≥ 15 → −5)
     *   catalyst is the symbol's best and ≥ 60%       → +8
     *   catalyst is the symbol's worst and &lt; 40%      → −10
     * </pre>
     * Symbols with fewer than {@code minAdjustmentTrades} closed trades get 0.
     */
    public ConfidenceAdjustment confidenceAdjustment(String symbol, String catalystType, TradeDirection direction) {
        String k = key(symbol);
        String catalyst = CatalystClassifier.normalize(catalystType);
        SymbolProfile p = profile(k).orElse(null);
        if (p == null || p.closedTrades() < settings.minAdjustmentTrades()) {
            int seen = p == null ? 0 : p.closedTrades();
            return new ConfidenceAdjustment(k, catalyst, direction, 0.0,
                List.of(fmt("Insufficient history: %d closed trades (need %d)", seen, settings.minAdjustmentTrades())),
                false);
        }

        double adjustment = 0.0;
        List<String> reasons = new ArrayList<>();
        double winRate = p.overallWinRate();
        if (winRate >= STRONG_WIN_RATE) {
            adjustment += STRONG_SYMBOL_BONUS;
            reasons.add(fmt("%s wins %.0f%% of %d trades", k, winRate, p.closedTrades()));
        } else if (winRate < WEAK_WIN_RATE) {
            adjustment += WEAK_SYMBOL_PENALTY;
            reasons.add(fmt("%s wins only %.0f%% of %d trades", k, winRate, p.closedTrades()));
        }

        if (direction != null && p.longWinRate() != null && p.shortWinRate() != null) {
            double requested = direction == TradeDirection.LONG ? p.longWinRate() : p.shortWinRate();
            double other = direction == TradeDirection.LONG ? p.shortWinRate() : p.longWinRate();
            if (requested - other >= DIRECTION_BIAS_GAP) {
                adjustment += DIRECTION_BIAS_STEP;
                reasons.add(fmt("%s ideas outperform the other side (%.0f%% vs %.0f%%)",
                                direction, requested, other));
            } else if (other - requested >= DIRECTION_BIAS_GAP) {
                adjustment -= DIRECTION_BIAS_STEP;
                reasons.add(fmt("%s ideas underperform the other side (%.0f%% vs %.0f%%)",
                                direction, requested, other));
            }
        }

        if (catalyst != null) {
            if (catalyst.equals(p.bestCatalyst()) && p.bestCatalystWinRate() >= BEST_CATALYST_WIN_RATE) {
                adjustment += BEST_CATALYST_BONUS;
                reasons.add(fmt("%s is the best catalyst for %s (%.0f%% win rate)",
                                catalyst, k, p.bestCatalystWinRate()));
            } else if (catalyst.equals(p.worstCatalyst()) && p.worstCatalystWinRate() < WORST_CATALYST_WIN_RATE) {
                adjustment += WORST_CATALYST_PENALTY;
                reasons.add(fmt("%s is the weakest catalyst for %s (%.0f%% win rate)",
                                catalyst, k, p.worstCatalystWinRate()));
            }
        }

        return new ConfidenceAdjustment(k, catalyst, direction, adjustment, List.copyOf(reasons), true);
    }

    static String key(String symbol) {
        return symbol == null ? "" : symbol.trim().toUpperCase(Locale.ROOT);
    }

    private static String fmt(String pattern, Object... args) {
        return String.format(Locale.ROOT, pattern, args);
    }
}
