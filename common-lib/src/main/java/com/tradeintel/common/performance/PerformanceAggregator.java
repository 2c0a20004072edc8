package com.tradeintel.common.performance;

import com.tradeintel.common.model.EngineMetrics;
import com.tradeintel.common.model.TradeOutcome;

import java.util.ArrayList;
import java.util.EnumMap;
import java.util.List;
import java.util.Map;
import java.util.TreeMap;
import java.util.function.Function;

/**
 * Stateless reducer from ledger rows to grouped {@link EngineMetrics}.
 *
 * <p>Only closed rows are aggregated. Rows are put in canonical chronological order before
 * reduction, so the output depends on the ledger contents and never on the order rows were
 * read in. Groups come back sorted by key.
 */
public final class PerformanceAggregator {

    private PerformanceAggregator() {}

    public static GroupedMetrics aggregate(List<TradeOutcome> outcomes, GroupingKey key) {
        List<EngineMetrics> groups = new ArrayList<>();
        int excluded = group(outcomes, key::keyOf, groups);
        return new GroupedMetrics(key, List.copyOf(groups), excluded);
    }

    /**
     * Groups by an arbitrary key function. Rows for which {@code keyFn} returns null are
     * excluded from this grouping.
     */
    public static List<EngineMetrics> aggregate(List<TradeOutcome> outcomes,
                                                Function<TradeOutcome, String> keyFn) {
        List<EngineMetrics> groups = new ArrayList<>();
        group(outcomes, keyFn, groups);
        return List.copyOf(groups);
    }

    /** Runs every {@link GroupingKey} over the same rows. */
    public static Map<GroupingKey, GroupedMetrics> aggregateAll(List<TradeOutcome> outcomes) {
        Map<GroupingKey, GroupedMetrics> all = new EnumMap<>(GroupingKey.class);
        for (GroupingKey key : GroupingKey.values()) {
            all.put(key, aggregate(outcomes, key));
        }
        return all;
    }

    /** Metrics over all closed rows as one group. */
    public static EngineMetrics summarize(String label, List<TradeOutcome> outcomes) {
        List<TradeOutcome> closed = outcomes.stream()
            .filter(TradeOutcome::isClosed)
            .sorted(TradeOutcome.CHRONOLOGICAL)
            .toList();
        return reduce(label, closed);
    }

    // ── internals ────────────────────────────────────────────────────────────

    private static int group(List<TradeOutcome> outcomes, Function<TradeOutcome, String> keyFn,
                             List<EngineMetrics> sink) {
        Map<String, List<TradeOutcome>> byKey = new TreeMap<>();
        int excluded = 0;
        for (TradeOutcome t : outcomes) {
            if (!t.isClosed()) continue;
            String key = keyFn.apply(t);
            if (key == null) {
                excluded++;
                continue;
            }
            byKey.computeIfAbsent(key, k -> new ArrayList<>()).add(t);
        }
        for (Map.Entry<String, List<TradeOutcome>> e : byKey.entrySet()) {
            List<TradeOutcome> rows = e.getValue();
            rows.sort(TradeOutcome.CHRONOLOGICAL);
            sink.add(reduce(e.getKey(), rows));
        }
        return excluded;
    }

    /** @param closed closed rows in chronological order */
    static EngineMetrics reduce(String key, List<TradeOutcome> closed) {
        int wins = 0, losses = 0, breakevens = 0;
        List<Double> returns = new ArrayList<>(closed.size());
        List<Double> winReturns = new ArrayList<>();
        List<Double> lossReturns = new ArrayList<>();
        List<Double> confidences = new ArrayList<>();

        for (TradeOutcome t : closed) {
            double r = t.returnPercent();
            returns.add(r);
            switch (t.resolution()) {
                case WIN -> {
                    wins++;
                    winReturns.add(r);
                }
                case LOSS -> {
                    losses++;
                    lossReturns.add(Math.abs(r));
                }
                default -> breakevens++;
            }
            if (t.hasUsableConfidence()) confidences.add(t.confidenceScore());
        }

        return new EngineMetrics(
            key,
            closed.size(),
            wins,
            losses,
            breakevens,
            ReturnStatistics.rate(wins, closed.size()),
            ReturnStatistics.mean(returns),
            ReturnStatistics.sharpe(returns),
            ReturnStatistics.profitFactor(returns),
            ReturnStatistics.maxDrawdown(returns),
            ReturnStatistics.mean(winReturns),
            ReturnStatistics.mean(lossReturns),
            ReturnStatistics.sum(returns),
            ReturnStatistics.mean(confidences)
        );
    }
}
