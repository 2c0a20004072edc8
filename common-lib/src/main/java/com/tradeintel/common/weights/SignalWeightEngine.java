package com.tradeintel.common.weights;

import com.tradeintel.common.exception.InvalidOverrideException;
import com.tradeintel.common.model.ConfidenceTier;
import com.tradeintel.common.model.SignalWeight;
import com.tradeintel.common.model.SignalWeightSummary;
import com.tradeintel.common.model.TradeOutcome;
import com.tradeintel.common.model.WeightAssignment;
import com.tradeintel.common.model.WeightedConfidence;
import com.tradeintel.common.performance.ReturnStatistics;

import java.util.ArrayList;
import java.util.Collection;
import java.util.Comparator;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.TreeMap;
import java.util.function.Function;
import java.util.stream.Collectors;

/**
 * Stateless calculator turning per-signal outcome statistics into multiplicative weights.
 *
 * <p><b>Dynamic weight</b> (per signal, n = closed trades carrying the signal):
 * <pre>
 *   tier = untested            → weight = 1.0
 *   raw    = winRate / baselineWinRate
 *   shrink = n / (n + priorStrength)
 *   weight = clamp(1 + (raw − 1) × shrink, minWeight, maxWeight)
 * </pre>
 * The clamp floor is the only place a weight is bounded below; it is always positive, so the
 * automatic process can damp a signal but never switch it off.
 *
 * <p><b>Overrides</b> replace the effective weight but keep the computed one
 * ({@link WeightAssignment.Overridden}). An override for a signal the ledger has never seen
 * produces an {@code untested} row.
 */
public final class SignalWeightEngine {

    static final double NEUTRAL_WEIGHT = 1.0;

    /** Weighted confidence uses half of the average weight's deviation from neutral. */
    static final double CONFIDENCE_DAMPING = 0.5;
    static final double MIN_ADJUSTED_CONFIDENCE = 10.0;
    static final double MAX_ADJUSTED_CONFIDENCE = 99.0;

    private static final Comparator<SignalWeight> BY_SIGNAL = Comparator.comparing(SignalWeight::signal);

    private SignalWeightEngine() {}

    /**
     * Computes the full weight table, sorted by signal name.
     *
     * @param outcomes  ledger rows; only closed ones count
     * @param overrides signal → manual weight (validated values)
     */
    public static List<SignalWeight> compute(List<TradeOutcome> outcomes,
                                             Map<String, Double> overrides,
                                             WeightSettings settings) {
        Map<String, Accumulator> bySignal = new TreeMap<>();
        outcomes.stream()
            .filter(TradeOutcome::isClosed)
            .sorted(TradeOutcome.CHRONOLOGICAL)
            .forEach(t -> {
                for (String signal : t.signals()) {
                    bySignal.computeIfAbsent(signal, s -> new Accumulator()).add(t);
                }
            });

        List<SignalWeight> rows = new ArrayList<>(bySignal.size());
        for (Map.Entry<String, Accumulator> e : bySignal.entrySet()) {
            Accumulator acc = e.getValue();
            ConfidenceTier tier = tierFor(acc.trades, settings);
            Double winRate = ReturnStatistics.rate(acc.wins, acc.trades);
            double dynamic = dynamicWeight(winRate, acc.trades, tier, settings);
            rows.add(SignalWeight.of(e.getKey(), acc.trades, acc.wins, acc.losses, acc.breakevens,
                                     winRate, ReturnStatistics.mean(acc.returns), tier,
                                     new WeightAssignment.Computed(dynamic)));
        }
        return applyOverrides(rows, overrides);
    }

    /**
     * Re-decides the effective weight of every row from an override map without touching the
     * ledger statistics. Rows that only existed because of a removed override disappear.
     */
    public static List<SignalWeight> applyOverrides(List<SignalWeight> rows, Map<String, Double> overrides) {
        Map<String, SignalWeight> bySignal = new TreeMap<>();
        for (SignalWeight row : rows) {
            if (row.tradeCount() == 0 && !overrides.containsKey(row.signal())) continue;
            bySignal.put(row.signal(), row.withAssignment(new WeightAssignment.Computed(row.dynamicWeight())));
        }
        overrides.forEach((signal, weight) -> {
            SignalWeight base = bySignal.get(signal);
            if (base == null) {
                bySignal.put(signal, SignalWeight.of(signal, 0, 0, 0, 0, null, null, ConfidenceTier.UNTESTED,
                                                     new WeightAssignment.Overridden(weight, NEUTRAL_WEIGHT)));
            } else {
                bySignal.put(signal, base.withAssignment(
                    new WeightAssignment.Overridden(weight, base.dynamicWeight())));
            }
        });
        List<SignalWeight> result = new ArrayList<>(bySignal.values());
        result.sort(BY_SIGNAL);
        return List.copyOf(result);
    }

    public static SignalWeightSummary summarize(List<SignalWeight> rows, WeightSettings settings) {
        double eps = settings.neutralEpsilon();
        int boosted = 0, reduced = 0, neutral = 0, overridden = 0;
        for (SignalWeight row : rows) {
            if (row.effectiveWeight() > NEUTRAL_WEIGHT + eps) boosted++;
            else if (row.effectiveWeight() < NEUTRAL_WEIGHT - eps) reduced++;
            else neutral++;
            if (row.overridden()) overridden++;
        }
        List<SignalWeight> topBoosted = rows.stream()
            .filter(r -> r.effectiveWeight() > NEUTRAL_WEIGHT + eps)
            .sorted(Comparator.comparingDouble(SignalWeight::effectiveWeight).reversed().thenComparing(BY_SIGNAL))
            .limit(settings.topN())
            .toList();
        List<SignalWeight> topReduced = rows.stream()
            .filter(r -> r.effectiveWeight() < NEUTRAL_WEIGHT - eps)
            .sorted(Comparator.comparingDouble(SignalWeight::effectiveWeight).thenComparing(BY_SIGNAL))
            .limit(settings.topN())
            .toList();
        return new SignalWeightSummary(settings.enabled(), rows.size(), boosted, reduced, neutral, overridden,
                                       topBoosted, topReduced, List.copyOf(rows));
    }

    /**
     * Applies the effective weights of {@code signals} to a base confidence.
     *
     * <pre>
     *   avg        = mean effective weight (signals without a row count as 1.0)
     *   multiplier = 1 + (avg − 1) × 0.5
     *   adjusted   = clamp(base × multiplier, 10, 99)
     * </pre>
     * When dynamic weighting is disabled the base confidence is returned unchanged.
     */
    public static WeightedConfidence weightedConfidence(List<SignalWeight> rows,
                                                        Collection<String> signals,
                                                        double baseConfidence,
                                                        WeightSettings settings) {
        if (!Double.isFinite(baseConfidence) || baseConfidence < 0.0 || baseConfidence > 100.0) {
            throw new IllegalArgumentException("baseConfidence must be in [0, 100], got " + baseConfidence);
        }
        Map<String, SignalWeight> index = rows.stream()
            .collect(Collectors.toMap(SignalWeight::signal, Function.identity()));
        Set<String> distinct = new LinkedHashSet<>();
        if (signals != null) {
            signals.stream().filter(s -> s != null && !s.isBlank()).map(String::trim).forEach(distinct::add);
        }

        List<String> known = new ArrayList<>();
        List<String> unknown = new ArrayList<>();
        double total = 0.0;
        for (String s : distinct) {
            SignalWeight row = index.get(s);
            if (row == null) {
                unknown.add(s);
                total += NEUTRAL_WEIGHT;
            } else {
                known.add(s);
                total += row.effectiveWeight();
            }
        }
        double avg = distinct.isEmpty() ? NEUTRAL_WEIGHT : total / distinct.size();

        if (!settings.enabled()) {
            return new WeightedConfidence(baseConfidence, baseConfidence, avg, 1.0,
                                          List.copyOf(known), List.copyOf(unknown), false);
        }
        double multiplier = 1.0 + (avg - 1.0) * CONFIDENCE_DAMPING;
        double adjusted = ReturnStatistics.clamp(baseConfidence * multiplier,
                                                 MIN_ADJUSTED_CONFIDENCE, MAX_ADJUSTED_CONFIDENCE);
        return new WeightedConfidence(baseConfidence, adjusted, avg, multiplier,
                                      List.copyOf(known), List.copyOf(unknown), true);
    }

    /** Rejects blank names and weights that are not positive finite numbers. Never clamps. */
    public static void validateOverride(String signal, double weight) {
        if (signal == null || signal.isBlank()) {
            throw new InvalidOverrideException(String.valueOf(signal), "signal name must not be blank");
        }
        if (Double.isNaN(weight) || Double.isInfinite(weight)) {
            throw new InvalidOverrideException(signal, "override weight must be a finite number, got " + weight);
        }
        if (weight <= 0.0) {
            throw new InvalidOverrideException(signal, "override weight must be positive, got " + weight);
        }
    }

    static ConfidenceTier tierFor(int trades, WeightSettings settings) {
        if (trades < settings.tierLow()) return ConfidenceTier.UNTESTED;
        if (trades < settings.tierMedium()) return ConfidenceTier.LOW;
        if (trades < settings.tierHigh()) return ConfidenceTier.MEDIUM;
        return ConfidenceTier.HIGH;
    }

    static double dynamicWeight(Double winRate, int trades, ConfidenceTier tier, WeightSettings settings) {
        if (tier == ConfidenceTier.UNTESTED || winRate == null) return NEUTRAL_WEIGHT;
        double raw = winRate / settings.baselineWinRate();
        double shrink = trades / (trades + settings.priorStrength());
        double weight = NEUTRAL_WEIGHT + (raw - 1.0) * shrink;
        return ReturnStatistics.clamp(weight, settings.minWeight(), settings.maxWeight());
    }

    private static final class Accumulator {
        int trades;
        int wins;
        int losses;
        int breakevens;
        final List<Double> returns = new ArrayList<>();

        void add(TradeOutcome t) {
            trades++;
            if (t.isWin()) wins++;
            else if (t.isLoss()) losses++;
            else breakevens++;
            returns.add(t.returnPercent());
        }
    }
}
