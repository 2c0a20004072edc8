package com.tradeintel.intelligence.service;

import com.tradeintel.common.calibration.CalibrationAnalyzer;
import com.tradeintel.common.calibration.CalibrationSettings;
import com.tradeintel.common.exception.RecomputeException;
import com.tradeintel.common.health.HealthThresholds;
import com.tradeintel.common.health.PlatformHealthEvaluator;
import com.tradeintel.common.intelligence.HistoricalIntelligenceIndex;
import com.tradeintel.common.intelligence.IndexSettings;
import com.tradeintel.common.ledger.LedgerSanitizer;
import com.tradeintel.common.ledger.SanitizedLedger;
import com.tradeintel.common.model.CalibrationReport;
import com.tradeintel.common.model.EngineMetrics;
import com.tradeintel.common.model.PlatformHealth;
import com.tradeintel.common.model.SignalWeight;
import com.tradeintel.common.model.TradeOutcome;
import com.tradeintel.common.narrative.NarrativeGenerator;
import com.tradeintel.common.performance.GroupedMetrics;
import com.tradeintel.common.performance.GroupingKey;
import com.tradeintel.common.performance.PerformanceAggregator;
import com.tradeintel.common.snapshot.IntelligenceSnapshot;
import com.tradeintel.common.snapshot.SnapshotCache;
import com.tradeintel.common.weights.SignalWeightEngine;
import com.tradeintel.common.weights.WeightSettings;
import com.tradeintel.intelligence.config.LedgerSettings;
import com.tradeintel.intelligence.dto.RefreshResultDTO;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;
import reactor.core.Disposable;
import reactor.core.Disposables;
import reactor.core.publisher.Mono;
import reactor.core.publisher.Sinks;
import reactor.core.scheduler.Schedulers;

import java.time.Instant;
import java.util.List;
import java.util.Map;
import java.util.concurrent.Callable;
import java.util.concurrent.atomic.AtomicReference;

/**
 * Full refresh of every derived table.
 *
 * <p>Flow: capture ledger version → read ledger → drop malformed rows → run the four reducers in
 * parallel → assemble one {@link IntelligenceSnapshot} → atomic swap. Any failure aborts the whole
 * run and leaves the installed snapshot untouched.
 *
 * <p>At most one refresh runs at a time. Callers arriving while one is in flight receive the
 * result of that run.
 */
@Service
public class RecomputeService {

    private static final Logger log = LoggerFactory.getLogger(RecomputeService.class);

    static final String AGGREGATE_LABEL = "ALL";

    private record InFlight(String trigger, Sinks.One<RefreshResultDTO> sink, Disposable.Swap subscription) {}

    private final LedgerService ledgerService;
    private final SignalOverrideService overrideService;
    private final SnapshotCache cache;
    private final NarrativeGenerator narrative;
    private final LedgerSettings ledgerSettings;
    private final CalibrationSettings calibrationSettings;
    private final WeightSettings weightSettings;
    private final IndexSettings indexSettings;
    private final HealthThresholds healthThresholds;
    private final AtomicReference<InFlight> inFlight = new AtomicReference<>();

    public RecomputeService(LedgerService ledgerService,
                            SignalOverrideService overrideService,
                            SnapshotCache cache,
                            NarrativeGenerator narrative,
                            LedgerSettings ledgerSettings,
                            CalibrationSettings calibrationSettings,
                            WeightSettings weightSettings,
                            IndexSettings indexSettings,
                            HealthThresholds healthThresholds) {
        this.ledgerService       = ledgerService;
        this.overrideService     = overrideService;
        this.cache               = cache;
        this.narrative           = narrative;
        this.ledgerSettings      = ledgerSettings;
        this.calibrationSettings = calibrationSettings;
        this.weightSettings      = weightSettings;
        this.indexSettings       = indexSettings;
        this.healthThresholds    = healthThresholds;
    }

    /**
     * Starts a refresh, or joins the one already running.
     *
     * @param trigger free-text origin (api, scheduler, first-query) used for logging
     * @return the refresh result; errors with {@link RecomputeException} on failure or abort
     */
    public Mono<RefreshResultDTO> refresh(String trigger) {
        return Mono.defer(() -> {
            while (true) {
                InFlight running = inFlight.get();
                if (running != null) {
                    log.info("Refresh already in progress; joining. trigger={} runningTrigger={}",
                             trigger, running.trigger());
                    return running.sink().asMono();
                }
                InFlight created = new InFlight(trigger, Sinks.one(), Disposables.swap());
                if (inFlight.compareAndSet(null, created)) {
                    start(created);
                    return created.sink().asMono();
                }
            }
        });
    }

    /**
     * Cancels the in-flight refresh. The previously installed snapshot stays in place.
     * A run that has already begun installing its snapshot can no longer be aborted.
     *
     * @return false when no refresh was running
     */
    public boolean abort() {
        InFlight running = inFlight.getAndSet(null);
        if (running == null) {
            return false;
        }
        running.subscription().dispose();
        running.sink().tryEmitError(
            new RecomputeException(RecomputeException.Kind.ABORTED, "refresh aborted by operator"));
        log.warn("Refresh aborted. trigger={}", running.trigger());
        return true;
    }

    public boolean isRunning() {
        return inFlight.get() != null;
    }

    // ── pipeline ─────────────────────────────────────────────────────────────

    private void start(InFlight run) {
        log.info("Refresh started. trigger={} ledgerVersion={}", run.trigger(), cache.ledgerVersion());
        Disposable subscription = pipeline(run).subscribe(
            result -> run.sink().tryEmitValue(result),
            error -> {
                inFlight.compareAndSet(run, null);
                // an aborted run already failed its sink
                if (run.sink().tryEmitError(error).isSuccess()) {
                    log.error("Refresh failed. trigger={} reason={}", run.trigger(), error.getMessage(), error);
                }
            });
        run.subscription().update(subscription);
    }

    private Mono<RefreshResultDTO> pipeline(InFlight run) {
        long startedAt = System.currentTimeMillis();
        long version = cache.ledgerVersion();

        Mono<List<TradeOutcome>> ledger = ledgerService.loadLedger()
            .onErrorMap(e -> !(e instanceof RecomputeException),
                        e -> new RecomputeException(RecomputeException.Kind.LEDGER_UNAVAILABLE,
                                                    "ledger read failed: " + e.getMessage(), e));
        Mono<Map<String, Double>> overrides = overrideService.loadOverrides()
            .onErrorMap(e -> !(e instanceof RecomputeException),
                        e -> new RecomputeException(RecomputeException.Kind.LEDGER_UNAVAILABLE,
                                                    "override table read failed: " + e.getMessage(), e));

        return Mono.zip(ledger, overrides)
            .flatMap(t -> compute(version, t.getT1(), t.getT2()))
            .map(candidate -> {
                // abort() contends on the same CAS; a claimed run is past the point of abort
                if (!inFlight.compareAndSet(run, null)) {
                    throw new RecomputeException(RecomputeException.Kind.ABORTED, "refresh aborted by operator");
                }
                boolean installed = cache.install(candidate, overrideService::applyTo);
                long duration = System.currentTimeMillis() - startedAt;
                if (installed) {
                    log.info("Refresh complete. trigger={} ledgerVersion={} outcomes={} malformed={} "
                             + "profiles={} signals={} durationMs={}",
                             run.trigger(), version, candidate.outcomesRead(), candidate.malformed(),
                             candidate.index().size(), candidate.signalWeights().size(), duration);
                } else {
                    log.info("Refresh superseded by a newer snapshot; discarded. trigger={} ledgerVersion={}",
                             run.trigger(), version);
                }
                return new RefreshResultDTO(
                    installed ? "COMPLETED" : "SUPERSEDED",
                    run.trigger(),
                    version,
                    candidate.outcomesRead(),
                    candidate.malformed(),
                    candidate.index().size(),
                    candidate.engines().size(),
                    candidate.signalWeights().size(),
                    duration,
                    Instant.now(),
                    null,
                    null);
            });
    }

    Mono<IntelligenceSnapshot> compute(long version, List<TradeOutcome> rows, Map<String, Double> overrides) {
        return Mono.defer(() -> {
            SanitizedLedger sanitized = LedgerSanitizer.sanitize(rows, ledgerSettings.breakevenBand());
            sanitized.rejected().forEach(r ->
                log.warn("Malformed ledger row excluded. id={} symbol={} reason={}", r.id(), r.symbol(), r.reason()));
            List<TradeOutcome> outcomes = sanitized.outcomes();

            Mono<Map<GroupingKey, GroupedMetrics>> performance =
                offload("performance", () -> PerformanceAggregator.aggregateAll(outcomes));
            Mono<CalibrationReport> calibration = offload("calibration", () -> {
                CalibrationReport report = CalibrationAnalyzer.analyze(outcomes, calibrationSettings);
                return report.withRecommendations(narrative.calibrationRecommendations(report));
            });
            Mono<List<SignalWeight>> weights =
                offload("signal-weights", () -> SignalWeightEngine.compute(outcomes, overrides, weightSettings));
            Mono<HistoricalIntelligenceIndex> index =
                offload("historical-index", () -> HistoricalIntelligenceIndex.build(outcomes, indexSettings));

            return Mono.zip(performance, calibration, weights, index).map(t -> {
                EngineMetrics aggregate = PerformanceAggregator.summarize(AGGREGATE_LABEL, outcomes);
                List<EngineMetrics> engines = t.getT1().get(GroupingKey.ENGINE).groups();
                PlatformHealth health = PlatformHealthEvaluator.evaluate(aggregate, engines, healthThresholds);
                health = health.withNarrative(narrative.healthIssues(health, engines),
                                              narrative.healthRecommendations(health, engines));
                return new IntelligenceSnapshot(
                    version,
                    Instant.now(),
                    rows.size(),
                    sanitized.rejected().size(),
                    t.getT1(),
                    aggregate,
                    health,
                    t.getT2(),
                    t.getT3(),
                    SignalWeightEngine.summarize(t.getT3(), weightSettings),
                    t.getT4());
            });
        }).onErrorMap(e -> !(e instanceof RecomputeException),
                      e -> new RecomputeException(RecomputeException.Kind.COMPUTATION_FAILED,
                                                  "derived table computation failed: " + e.getMessage(), e));
    }

    private static <T> Mono<T> offload(String component, Callable<T> reducer) {
        return Mono.fromCallable(() -> {
                long t0 = System.nanoTime();
                T result = reducer.call();
                log.debug("Reducer finished. component={} micros={}", component, (System.nanoTime() - t0) / 1_000);
                return result;
            })
            .subscribeOn(Schedulers.parallel());
    }
}
