package com.tradeintel.common.snapshot;

import com.tradeintel.common.intelligence.HistoricalIntelligenceIndex;
import com.tradeintel.common.model.CalibrationReport;
import com.tradeintel.common.model.EngineMetrics;
import com.tradeintel.common.model.PlatformHealth;
import com.tradeintel.common.model.SignalWeight;
import com.tradeintel.common.model.SignalWeightSummary;
import com.tradeintel.common.performance.GroupedMetrics;
import com.tradeintel.common.performance.GroupingKey;

import java.time.Instant;
import java.util.List;
import java.util.Map;

/**
 * Every derived table computed from one ledger version. Instances are immutable and replaced
 * wholesale; readers holding a reference always see one consistent generation.
 *
 * @param ledgerVersion   ledger version the snapshot was computed from
 * @param outcomesRead    ledger rows read
 * @param malformed       rows rejected before aggregation
 */
public record IntelligenceSnapshot(
    long                              ledgerVersion,
    Instant                           computedAt,
    int                               outcomesRead,
    int                               malformed,
    Map<GroupingKey, GroupedMetrics>  performance,
    EngineMetrics                     aggregate,
    PlatformHealth                    health,
    CalibrationReport                 calibration,
    List<SignalWeight>                signalWeights,
    SignalWeightSummary               signalSummary,
    HistoricalIntelligenceIndex       index
) {

    public List<EngineMetrics> engines() {
        GroupedMetrics byEngine = performance.get(GroupingKey.ENGINE);
        return byEngine == null ? List.of() : byEngine.groups();
    }

    /** Same generation with a re-decided signal weight table (override set or removed). */
    public IntelligenceSnapshot withSignalWeights(List<SignalWeight> weights, SignalWeightSummary summary) {
        return new IntelligenceSnapshot(ledgerVersion, computedAt, outcomesRead, malformed, performance,
                                        aggregate, health, calibration, List.copyOf(weights), summary, index);
    }
}
