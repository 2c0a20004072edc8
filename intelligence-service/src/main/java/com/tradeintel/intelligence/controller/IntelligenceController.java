package com.tradeintel.intelligence.controller;

import com.tradeintel.common.exception.InvalidOverrideException;
import com.tradeintel.common.exception.RecomputeException;
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
import com.tradeintel.common.performance.GroupedMetrics;
import com.tradeintel.common.performance.GroupingKey;
import com.tradeintel.intelligence.dto.OverrideRequest;
import com.tradeintel.intelligence.dto.RefreshResultDTO;
import com.tradeintel.intelligence.dto.SnapshotStatusDTO;
import com.tradeintel.intelligence.dto.WeightedConfidenceRequest;
import com.tradeintel.intelligence.service.IntelligenceQueryService;
import com.tradeintel.intelligence.service.RecomputeService;
import com.tradeintel.intelligence.service.SignalOverrideService;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;
import reactor.core.publisher.Mono;

import java.util.List;
import java.util.Map;
import java.util.Optional;

@RestController
@RequestMapping("/api/v1/intelligence")
public class IntelligenceController {

    private static final Logger log = LoggerFactory.getLogger(IntelligenceController.class);

    private final IntelligenceQueryService queryService;
    private final RecomputeService recomputeService;
    private final SignalOverrideService overrideService;

    public IntelligenceController(IntelligenceQueryService queryService,
                                  RecomputeService recomputeService,
                                  SignalOverrideService overrideService) {
        this.queryService     = queryService;
        this.recomputeService = recomputeService;
        this.overrideService  = overrideService;
    }

    // ── performance & health ───────────────────────────────────────────────

    @GetMapping("/engines")
    public Mono<ResponseEntity<List<EngineMetrics>>> engines() {
        log.info("Engine metrics query received");
        return queryService.engines()
            .map(ResponseEntity::ok)
            .defaultIfEmpty(ResponseEntity.notFound().build())
            .doOnError(e -> log.error("Engine metrics endpoint error", e));
    }

    @GetMapping("/metrics")
    public Mono<ResponseEntity<GroupedMetrics>> metrics(@RequestParam(required = false) String groupBy) {
        log.info("Grouped metrics query received. groupBy={}", groupBy);
        return Mono.fromCallable(() -> GroupingKey.fromParam(groupBy))
            .flatMap(queryService::metrics)
            .map(ResponseEntity::ok)
            .defaultIfEmpty(ResponseEntity.notFound().build())
            .doOnError(e -> log.error("Grouped metrics endpoint error. groupBy={}", groupBy, e));
    }

    @GetMapping("/health")
    public Mono<ResponseEntity<PlatformHealth>> health() {
        log.info("Platform health query received");
        return queryService.health()
            .map(ResponseEntity::ok)
            .defaultIfEmpty(ResponseEntity.notFound().build())
            .doOnError(e -> log.error("Platform health endpoint error", e));
    }

    @GetMapping("/calibration")
    public Mono<ResponseEntity<CalibrationReport>> calibration() {
        log.info("Calibration report query received");
        return queryService.calibration()
            .map(ResponseEntity::ok)
            .defaultIfEmpty(ResponseEntity.notFound().build())
            .doOnError(e -> log.error("Calibration endpoint error", e));
    }

    // ── signal weights ─────────────────────────────────────────────────────

    @GetMapping("/signal-weights")
    public Mono<ResponseEntity<SignalWeightSummary>> signalWeights() {
        log.info("Signal weight summary query received");
        return queryService.signalWeights()
            .map(ResponseEntity::ok)
            .defaultIfEmpty(ResponseEntity.notFound().build())
            .doOnError(e -> log.error("Signal weight endpoint error", e));
    }

    @GetMapping("/signal-weights/{signal}")
    public Mono<ResponseEntity<SignalWeight>> signalWeight(@PathVariable String signal) {
        log.info("Signal weight query received. signal={}", signal);
        return queryService.signalWeight(signal)
            .map(ResponseEntity::ok)
            .defaultIfEmpty(ResponseEntity.notFound().build())
            .doOnError(e -> log.error("Signal weight endpoint error. signal={}", signal, e));
    }

    @PutMapping("/signal-weights/{signal}/override")
    public Mono<ResponseEntity<SignalWeight>> setOverride(@PathVariable String signal,
                                                          @RequestBody OverrideRequest request) {
        log.info("Signal weight override requested. signal={} weight={}", signal, request.weight());
        if (request.weight() == null) {
            return Mono.error(new InvalidOverrideException(signal, "override weight is required"));
        }
        return overrideService.setOverride(signal, request.weight(), request.reason())
            .map(ResponseEntity::ok)
            .doOnError(e -> log.error("Override endpoint error. signal={}", signal, e));
    }

    @DeleteMapping("/signal-weights/{signal}/override")
    public Mono<ResponseEntity<Void>> removeOverride(@PathVariable String signal) {
        log.info("Signal weight override removal requested. signal={}", signal);
        return overrideService.removeOverride(signal)
            .map(removed -> removed
                ? ResponseEntity.noContent().<Void>build()
                : ResponseEntity.notFound().<Void>build())
            .doOnError(e -> log.error("Override removal endpoint error. signal={}", signal, e));
    }

    @PostMapping("/signal-weights/weighted-confidence")
    public Mono<ResponseEntity<WeightedConfidence>> weightedConfidence(
            @RequestBody WeightedConfidenceRequest request) {
        log.info("Weighted confidence requested. signals={} base={}", request.signals(), request.baseConfidence());
        return queryService.weightedConfidence(request.signals(), request.baseConfidence())
            .map(ResponseEntity::ok)
            .defaultIfEmpty(ResponseEntity.notFound().build())
            .doOnError(e -> log.error("Weighted confidence endpoint error", e));
    }

    // ── historical intelligence ────────────────────────────────────────────

    @GetMapping("/historical/stats")
    public Mono<ResponseEntity<PlatformStats>> platformStats() {
        log.info("Platform stats query received");
        return queryService.platformStats()
            .map(ResponseEntity::ok)
            .defaultIfEmpty(ResponseEntity.notFound().build())
            .doOnError(e -> log.error("Platform stats endpoint error", e));
    }

    @GetMapping("/historical/symbols/{symbol}")
    public Mono<ResponseEntity<SymbolIntelligence>> symbol(@PathVariable String symbol) {
        log.info("Symbol intelligence query received. symbol={}", symbol);
        return queryService.symbol(symbol)
            .map(ResponseEntity::ok)
            .defaultIfEmpty(ResponseEntity.notFound().build())
            .doOnError(e -> log.error("Symbol intelligence endpoint error. symbol={}", symbol, e));
    }

    @GetMapping("/historical/confidence-adjustment")
    public Mono<ResponseEntity<ConfidenceAdjustment>> confidenceAdjustment(
            @RequestParam String symbol,
            @RequestParam(required = false) String catalyst,
            @RequestParam(required = false) String direction) {
        log.info("Confidence adjustment requested. symbol={} catalyst={} direction={}", symbol, catalyst, direction);
        return Mono.fromCallable(() -> parseDirection(direction))
            .flatMap(dir -> queryService.confidenceAdjustment(symbol, catalyst, dir.orElse(null)))
            .map(ResponseEntity::ok)
            .defaultIfEmpty(ResponseEntity.notFound().build())
            .doOnError(e -> log.error("Confidence adjustment endpoint error. symbol={}", symbol, e));
    }

    // ── refresh & status ───────────────────────────────────────────────────

    @PostMapping("/refresh")
    public Mono<ResponseEntity<RefreshResultDTO>> refresh() {
        log.info("Manual refresh requested");
        return recomputeService.refresh("api")
            .map(ResponseEntity::ok)
            .onErrorResume(RecomputeException.class, e -> {
                HttpStatus status = e.getKind() == RecomputeException.Kind.ABORTED
                    ? HttpStatus.CONFLICT
                    : HttpStatus.SERVICE_UNAVAILABLE;
                return Mono.just(ResponseEntity.status(status).body(RefreshResultDTO.failed(e)));
            });
    }

    @PostMapping("/refresh/abort")
    public Mono<ResponseEntity<Map<String, Boolean>>> abort() {
        log.info("Refresh abort requested");
        return Mono.fromCallable(() -> Map.of("aborted", recomputeService.abort()))
            .map(ResponseEntity::ok);
    }

    @GetMapping("/status")
    public Mono<ResponseEntity<SnapshotStatusDTO>> status() {
        return Mono.fromCallable(queryService::status).map(ResponseEntity::ok);
    }

    private static Optional<TradeDirection> parseDirection(String direction) {
        if (direction == null || direction.isBlank()) {
            return Optional.empty();
        }
        TradeDirection parsed = TradeDirection.fromString(direction);
        if (parsed == null) {
            throw new IllegalArgumentException("unknown direction: " + direction);
        }
        return Optional.of(parsed);
    }
}
