package com.tradeintel.intelligence.service;

import com.tradeintel.common.model.CalibrationReport;
import com.tradeintel.common.model.ConfidenceAdjustment;
import com.tradeintel.common.model.EngineMetrics;
import com.tradeintel.common.model.PlatformHealth;
import com.tradeintel.common.model.PlatformStats;
import com.tradeintel.common.model.SignalWeight;
import com.tradeintel.common.model.SignalWeightSummary;
import com.tradeintel.common.model.SymbolIntelligence;
import com.tradeintel.common.model.TradeDirection;
import com.tradeintel.common.model.WeightedConfidence;
import com.tradeintel.common.narrative.NarrativeGenerator;
import com.tradeintel.common.performance.GroupedMetrics;
import com.tradeintel.common.performance.GroupingKey;
import com.tradeintel.common.snapshot.IntelligenceSnapshot;
import com.tradeintel.common.snapshot.SnapshotCache;
import com.tradeintel.common.weights.SignalWeightEngine;
import com.tradeintel.common.weights.WeightSettings;
import com.tradeintel.intelligence.dto.SnapshotStatusDTO;
import org.springframework.stereotype.Service;
import reactor.core.publisher.Mono;

import java.util.List;

/**
 * Read side. Every query answers from the installed snapshot, Stale or Fresh; the first query
 * after startup triggers a refresh when nothing is installed yet.
 */
@Service
public class IntelligenceQueryService {

    private final SnapshotCache cache;
    private final RecomputeService recomputeService;
    private final NarrativeGenerator narrative;
    private final WeightSettings weightSettings;

    public IntelligenceQueryService(SnapshotCache cache,
                                    RecomputeService recomputeService,
                                    NarrativeGenerator narrative,
                                    WeightSettings weightSettings) {
        this.cache            = cache;
        this.recomputeService = recomputeService;
        this.narrative        = narrative;
        this.weightSettings   = weightSettings;
    }

    public Mono<IntelligenceSnapshot> snapshot() {
        return Mono.defer(() -> cache.current()
            .map(Mono::just)
            .orElseGet(() -> recomputeService.refresh("first-query")
                .then(Mono.defer(() -> Mono.justOrEmpty(cache.current())))));
    }

    public Mono<List<EngineMetrics>> engines() {
        return snapshot().map(IntelligenceSnapshot::engines);
    }

    public Mono<GroupedMetrics> metrics(GroupingKey groupBy) {
        return snapshot().map(s -> s.performance().get(groupBy));
    }

    public Mono<PlatformHealth> health() {
        return snapshot().map(IntelligenceSnapshot::health);
    }

    public Mono<CalibrationReport> calibration() {
        return snapshot().map(IntelligenceSnapshot::calibration);
    }

    public Mono<SignalWeightSummary> signalWeights() {
        return snapshot().map(IntelligenceSnapshot::signalSummary);
    }

    /** Empty when the signal has neither ledger history nor an override. */
    public Mono<SignalWeight> signalWeight(String signal) {
        String name = signal == null ? "" : signal.trim();
        return snapshot().flatMap(s -> Mono.justOrEmpty(
            s.signalWeights().stream().filter(w -> w.signal().equals(name)).findFirst()));
    }

    public Mono<WeightedConfidence> weightedConfidence(List<String> signals, double baseConfidence) {
        return snapshot().map(s ->
            SignalWeightEngine.weightedConfidence(s.signalWeights(), signals, baseConfidence, weightSettings));
    }

    public Mono<PlatformStats> platformStats() {
        return snapshot().map(s -> s.index().platformStats());
    }

    public Mono<SymbolIntelligence> symbol(String symbol) {
        return snapshot().map(s -> s.index().lookup(symbol, narrative));
    }

    public Mono<ConfidenceAdjustment> confidenceAdjustment(String symbol, String catalystType,
                                                           TradeDirection direction) {
        return snapshot().map(s -> s.index().confidenceAdjustment(symbol, catalystType, direction));
    }

    public SnapshotStatusDTO status() {
        IntelligenceSnapshot installed = cache.current().orElse(null);
        return new SnapshotStatusDTO(
            cache.state(),
            cache.ledgerVersion(),
            installed == null ? -1L : installed.ledgerVersion(),
            installed == null ? null : installed.computedAt(),
            recomputeService.isRunning());
    }
}
