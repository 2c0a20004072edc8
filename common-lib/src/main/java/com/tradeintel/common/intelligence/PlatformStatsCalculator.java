package com.tradeintel.common.intelligence;

import com.tradeintel.common.calibration.ConfidenceBandTable;
import com.tradeintel.common.model.BreakdownRow;
import com.tradeintel.common.model.PlatformStats;
import com.tradeintel.common.model.PlatformTotals;
import com.tradeintel.common.model.SymbolProfile;
import com.tradeintel.common.model.TradeOutcome;
import com.tradeintel.common.performance.ReturnStatistics;

import java.util.ArrayList;
import java.util.Collection;
import java.util.Comparator;
import java.util.List;
import java.util.Map;
import java.util.TreeMap;
import java.util.function.Function;

/** Platform-wide breakdowns, leaderboard and performer lists. */
public final class PlatformStatsCalculator {

    private PlatformStatsCalculator() {}

    public static PlatformStats compute(List<TradeOutcome> outcomes, Collection<SymbolProfile> profiles,
                                        IndexSettings settings) {
        List<BreakdownRow> byCatalyst = new ArrayList<>(breakdown(outcomes, TradeOutcome::catalystType));
        byCatalyst.sort(Comparator.comparing(BreakdownRow::winRate, Comparator.nullsLast(Comparator.reverseOrder()))
            .thenComparing(BreakdownRow::key));

        List<SymbolProfile> leaderboard = profiles.stream()
            .sorted(Comparator.comparingInt(SymbolProfile::totalIdeas).reversed()
                .thenComparing(SymbolProfile::symbol))
            .toList();

        List<SymbolProfile> ranked = profiles.stream()
            .filter(p -> p.closedTrades() >= settings.minPerformerTrades())
            .toList();
        List<SymbolProfile> top = ranked.stream()
            .sorted(Comparator.comparing(SymbolProfile::overallWinRate).reversed()
                .thenComparing(SymbolProfile::totalReturnPercent, Comparator.reverseOrder())
                .thenComparing(SymbolProfile::symbol))
            .limit(settings.performerLimit())
            .toList();
        List<SymbolProfile> worst = ranked.stream()
            .sorted(Comparator.comparing(SymbolProfile::overallWinRate)
                .thenComparing(SymbolProfile::totalReturnPercent)
                .thenComparing(SymbolProfile::symbol))
            .limit(settings.performerLimit())
            .toList();

        return new PlatformStats(
            totals(outcomes),
            breakdown(outcomes, TradeOutcome::engine),
            breakdown(outcomes, TradeOutcome::assetType),
            breakdown(outcomes, t -> t.direction() == null ? null : t.direction().name()),
            List.copyOf(byCatalyst),
            leaderboard,
            ConfidenceBandTable.build(outcomes),
            top,
            worst
        );
    }

    static PlatformTotals totals(List<TradeOutcome> outcomes) {
        int closed = 0, wins = 0, losses = 0, breakevens = 0;
        List<Double> returns = new ArrayList<>();
        List<Double> pnl = new ArrayList<>();
        for (TradeOutcome t : outcomes) {
            if (!t.isClosed()) continue;
            closed++;
            if (t.isWin()) wins++;
            else if (t.isLoss()) losses++;
            else breakevens++;
            returns.add(t.returnPercent());
            if (t.realizedPnl() != null) pnl.add(t.realizedPnl());
        }
        return new PlatformTotals(outcomes.size(), closed, wins, losses, breakevens,
                                  ReturnStatistics.rate(wins, closed), ReturnStatistics.sum(pnl),
                                  ReturnStatistics.mean(returns), ReturnStatistics.profitFactor(returns));
    }

    /** One row per key value, sorted by key. Rows lacking the key are skipped. */
    static List<BreakdownRow> breakdown(List<TradeOutcome> outcomes, Function<TradeOutcome, String> keyFn) {
        Map<String, List<TradeOutcome>> byKey = new TreeMap<>();
        for (TradeOutcome t : outcomes) {
            String key = keyFn.apply(t);
            if (key == null || key.isBlank()) continue;
            byKey.computeIfAbsent(key, k -> new ArrayList<>()).add(t);
        }
        List<BreakdownRow> rows = new ArrayList<>(byKey.size());
        byKey.forEach((key, members) -> {
            int closed = 0, wins = 0, losses = 0;
            List<Double> returns = new ArrayList<>();
            List<Double> pnl = new ArrayList<>();
            for (TradeOutcome t : members) {
                if (!t.isClosed()) continue;
                closed++;
                if (t.isWin()) wins++;
                else if (t.isLoss()) losses++;
                returns.add(t.returnPercent());
                if (t.realizedPnl() != null) pnl.add(t.realizedPnl());
            }
            rows.add(new BreakdownRow(key, members.size(), closed, wins, losses,
                                      ReturnStatistics.rate(wins, closed),
                                      ReturnStatistics.mean(returns), ReturnStatistics.sum(pnl)));
        });
        return List.copyOf(rows);
    }
}
