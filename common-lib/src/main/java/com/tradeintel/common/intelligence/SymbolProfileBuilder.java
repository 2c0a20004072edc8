package com.tradeintel.common.intelligence;

import com.tradeintel.common.model.CatalystStat;
import com.tradeintel.common.model.SymbolProfile;
import com.tradeintel.common.model.TradeDirection;
import com.tradeintel.common.model.TradeOutcome;
import com.tradeintel.common.performance.ReturnStatistics;

import java.time.Instant;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.TreeMap;

/**
 * Builds a {@link SymbolProfile} and its catalyst breakdown from every ledger row of one symbol.
 */
public final class SymbolProfileBuilder {

    /** Combined rows first, then LONG, then SHORT within a catalyst. */
    static final Comparator<CatalystStat> CATALYST_ORDER =
        Comparator.comparing(CatalystStat::catalystType)
            .thenComparing(CatalystStat::direction, Comparator.nullsFirst(Comparator.naturalOrder()));

    private SymbolProfileBuilder() {}

    /** @param rows all ledger rows of the symbol, open and closed */
    public static SymbolProfile build(String symbol, List<TradeOutcome> rows, IndexSettings settings) {
        List<TradeOutcome> closed = rows.stream()
            .filter(TradeOutcome::isClosed)
            .sorted(TradeOutcome.CHRONOLOGICAL)
            .toList();
        Instant lastTradeAt = rows.stream()
            .map(TradeOutcome::lastActivity)
            .filter(Objects::nonNull)
            .max(Comparator.naturalOrder())
            .orElse(null);

        if (closed.isEmpty()) {
            return new SymbolProfile(symbol, rows.size(), 0, 0, 0, 0, null, 0, null, 0, null,
                                     null, null, null, null, null, null, null, null, null,
                                     null, null, lastTradeAt);
        }

        int wins = 0, losses = 0, breakevens = 0;
        int longTrades = 0, longWins = 0, shortTrades = 0, shortWins = 0;
        List<Double> returns = new ArrayList<>();
        List<Double> winReturns = new ArrayList<>();
        List<Double> lossReturns = new ArrayList<>();
        List<Double> pnl = new ArrayList<>();
        List<Double> confidences = new ArrayList<>();

        for (TradeOutcome t : closed) {
            double r = t.returnPercent();
            returns.add(r);
            if (t.isWin()) {
                wins++;
                winReturns.add(r);
            } else if (t.isLoss()) {
                losses++;
                lossReturns.add(Math.abs(r));
            } else {
                breakevens++;
            }
            if (t.direction() == TradeDirection.LONG) {
                longTrades++;
                if (t.isWin()) longWins++;
            } else if (t.direction() == TradeDirection.SHORT) {
                shortTrades++;
                if (t.isWin()) shortWins++;
            }
            if (t.realizedPnl() != null) pnl.add(t.realizedPnl());
            if (t.hasUsableConfidence()) confidences.add(t.confidenceScore());
        }

        Double winRate = ReturnStatistics.rate(wins, closed.size());
        Double avgConfidence = ReturnStatistics.mean(confidences);
        Double actualVsPredicted = avgConfidence == null || avgConfidence <= 0.0
            ? null
            : winRate / avgConfidence * 100.0;

        List<CatalystStat> combined = catalystBreakdown(closed).stream()
            .filter(c -> c.direction() == null)
            .toList();
        Optional<CatalystStat> best = bestCatalyst(combined, settings.minCatalystSamples());
        Optional<CatalystStat> worst = worstCatalyst(combined, settings.minCatalystSamples());

        return new SymbolProfile(
            symbol,
            rows.size(),
            closed.size(),
            wins,
            losses,
            breakevens,
            winRate,
            longTrades,
            ReturnStatistics.rate(longWins, longTrades),
            shortTrades,
            ReturnStatistics.rate(shortWins, shortTrades),
            ReturnStatistics.sum(pnl),
            ReturnStatistics.sum(returns),
            ReturnStatistics.mean(winReturns),
            ReturnStatistics.mean(lossReturns),
            ReturnStatistics.profitFactor(returns),
            best.map(CatalystStat::catalystType).orElse(null),
            best.map(CatalystStat::winRate).orElse(null),
            worst.map(CatalystStat::catalystType).orElse(null),
            worst.map(CatalystStat::winRate).orElse(null),
            avgConfidence,
            actualVsPredicted,
            lastTradeAt
        );
    }

    /**
     * Per-catalyst statistics of closed rows: one combined row per catalyst plus one row per
     * direction present. Rows without a catalyst type are skipped.
     */
    public static List<CatalystStat> catalystBreakdown(List<TradeOutcome> rows) {
        Map<String, List<TradeOutcome>> byCatalyst = new TreeMap<>();
        for (TradeOutcome t : rows) {
            if (!t.isClosed() || t.catalystType() == null) continue;
            byCatalyst.computeIfAbsent(t.catalystType(), k -> new ArrayList<>()).add(t);
        }
        List<CatalystStat> stats = new ArrayList<>();
        byCatalyst.forEach((catalyst, members) -> {
            members.sort(TradeOutcome.CHRONOLOGICAL);
            stats.add(stat(catalyst, null, members));
            for (TradeDirection d : TradeDirection.values()) {
                List<TradeOutcome> side = members.stream().filter(t -> t.direction() == d).toList();
                if (!side.isEmpty()) stats.add(stat(catalyst, d, side));
            }
        });
        stats.sort(CATALYST_ORDER);
        return List.copyOf(stats);
    }

    /** Highest win rate among catalysts with enough trades; ties go to the larger sample, then name. */
    public static Optional<CatalystStat> bestCatalyst(List<CatalystStat> combined, int minSamples) {
        return combined.stream()
            .filter(c -> c.trades() >= minSamples && c.winRate() != null)
            .min(Comparator.comparing(CatalystStat::winRate).reversed()
                .thenComparing(Comparator.comparingInt(CatalystStat::trades).reversed())
                .thenComparing(CatalystStat::catalystType));
    }

    /** Lowest win rate among catalysts with enough trades; ties go to the larger sample, then name. */
    public static Optional<CatalystStat> worstCatalyst(List<CatalystStat> combined, int minSamples) {
        return combined.stream()
            .filter(c -> c.trades() >= minSamples && c.winRate() != null)
            .min(Comparator.comparing(CatalystStat::winRate)
                .thenComparing(Comparator.comparingInt(CatalystStat::trades).reversed())
                .thenComparing(CatalystStat::catalystType));
    }

    private static CatalystStat stat(String catalyst, TradeDirection direction, List<TradeOutcome> members) {
        int wins = 0, losses = 0;
        List<Double> returns = new ArrayList<>();
        List<Double> pnl = new ArrayList<>();
        for (TradeOutcome t : members) {
            if (t.isWin()) wins++;
            else if (t.isLoss()) losses++;
            returns.add(t.returnPercent());
            if (t.realizedPnl() != null) pnl.add(t.realizedPnl());
        }
        return new CatalystStat(catalyst, direction, members.size(), wins, losses,
                                ReturnStatistics.rate(wins, members.size()),
                                ReturnStatistics.mean(returns), ReturnStatistics.sum(pnl));
    }
}
