package com.tradeintel.intelligence.service;

import com.tradeintel.common.calibration.CalibrationSettings;
import com.tradeintel.common.exception.RecomputeException;
import com.tradeintel.common.health.HealthThresholds;
import com.tradeintel.common.intelligence.IndexSettings;
import com.tradeintel.common.model.TradeOutcome;
import com.tradeintel.common.narrative.NarrativeGenerator;
import com.tradeintel.common.narrative.RuleBasedNarrativeGenerator;
import com.tradeintel.common.snapshot.DerivedState;
import com.tradeintel.common.snapshot.IntelligenceSnapshot;
import com.tradeintel.common.snapshot.SnapshotCache;
import com.tradeintel.common.weights.WeightSettings;
import com.tradeintel.intelligence.LedgerRows;
import com.tradeintel.intelligence.config.LedgerSettings;
import com.tradeintel.intelligence.dto.RefreshResultDTO;
import com.tradeintel.intelligence.repository.SignalWeightOverrideRepository;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import reactor.core.publisher.Flux;
import reactor.core.publisher.Mono;
import reactor.core.publisher.Sinks;
import reactor.test.StepVerifier;

import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.concurrent.atomic.AtomicReference;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.*;

class RecomputeServiceTest {

    private static final Duration TIMEOUT = Duration.ofSeconds(10);

    private LedgerService ledgerService;
    private SnapshotCache cache;
    private SignalOverrideService overrideService;

    @BeforeEach
    void setUp() {
        ledgerService = mock(LedgerService.class);
        cache = new SnapshotCache();
        SignalWeightOverrideRepository overrideRepository = mock(SignalWeightOverrideRepository.class);
        when(overrideRepository.findAll()).thenReturn(Flux.empty());
        overrideService = new SignalOverrideService(overrideRepository, cache, WeightSettings.DEFAULTS);
    }

    private RecomputeService service(NarrativeGenerator narrative) {
        return new RecomputeService(ledgerService, overrideService, cache, narrative,
                                    new LedgerSettings(0.1, 20), CalibrationSettings.DEFAULTS,
                                    WeightSettings.DEFAULTS, IndexSettings.DEFAULTS, HealthThresholds.DEFAULTS);
    }

    private RecomputeService service() {
        return service(new RuleBasedNarrativeGenerator());
    }

    private static List<TradeOutcome> ledger() {
        List<TradeOutcome> rows = new ArrayList<>(LedgerRows.signalHistory("VWAP Cross", 28, 12));
        rows.add(LedgerRows.inconsistent(99));
        return rows;
    }

    // ── successful refresh ───────────────────────────────────────────────────

    @Nested
    @DisplayName("successful refresh")
    class Success {

        @Test
        @DisplayName("installs a snapshot for the current ledger version and reports counts")
        void installsFresh() {
            cache.markStale();
            when(ledgerService.loadLedger()).thenReturn(Mono.just(ledger()));

            StepVerifier.create(service().refresh("test"))
                .assertNext(r -> {
                    assertEquals("COMPLETED", r.status());
                    assertEquals(1, r.ledgerVersion());
                    assertEquals(41, r.outcomesRead());
                    assertEquals(1, r.malformedRecords());
                    assertEquals(2, r.profilesUpdated());
                    assertEquals(2, r.engineGroups());
                    assertEquals(1, r.signalsWeighted());
                    assertNull(r.errorKind());
                })
                .expectComplete()
                .verify(TIMEOUT);

            assertEquals(DerivedState.FRESH, cache.state());
            IntelligenceSnapshot s = cache.current().orElseThrow();
            assertEquals(40, s.aggregate().tradeCount());
            assertEquals(RecomputeService.AGGREGATE_LABEL, s.aggregate().key());
        }

        @Test
        @DisplayName("two refreshes over an unchanged ledger produce identical derived tables")
        void idempotent() {
            when(ledgerService.loadLedger()).thenReturn(Mono.just(ledger()));
            RecomputeService service = service();

            service.refresh("first").block(TIMEOUT);
            IntelligenceSnapshot first = cache.current().orElseThrow();
            service.refresh("second").block(TIMEOUT);
            IntelligenceSnapshot second = cache.current().orElseThrow();

            assertNotSame(first, second);
            assertEquals(first.performance(), second.performance());
            assertEquals(first.calibration(), second.calibration());
            assertEquals(first.signalWeights(), second.signalWeights());
            assertEquals(first.index().profiles(), second.index().profiles());
            assertEquals(first.health(), second.health());
        }

        @Test
        @DisplayName("concurrent callers share one in-flight run")
        void concurrentCallersJoin() {
            Sinks.One<List<TradeOutcome>> gate = Sinks.one();
            when(ledgerService.loadLedger()).thenReturn(gate.asMono());
            RecomputeService service = service();

            Mono<RefreshResultDTO> first = service.refresh("api").cache();
            first.subscribe();
            assertTrue(service.isRunning());
            Mono<RefreshResultDTO> second = service.refresh("scheduler").cache();
            second.subscribe();

            gate.tryEmitValue(ledger());

            RefreshResultDTO a = first.block(TIMEOUT);
            RefreshResultDTO b = second.block(TIMEOUT);
            assertSame(a, b);
            assertEquals("api", a.trigger());
            assertFalse(service.isRunning());
            verify(ledgerService, times(1)).loadLedger();
        }
    }

    // ── failures ─────────────────────────────────────────────────────────────

    @Nested
    @DisplayName("failures leave the previous snapshot in place")
    class Failures {

        private IntelligenceSnapshot installBaseline(RecomputeService service) {
            when(ledgerService.loadLedger()).thenReturn(Mono.just(ledger()));
            service.refresh("baseline").block(TIMEOUT);
            return cache.current().orElseThrow();
        }

        @Test
        @DisplayName("ledger read failure → LEDGER_UNAVAILABLE")
        void ledgerUnavailable() {
            RecomputeService service = service();
            IntelligenceSnapshot baseline = installBaseline(service);
            cache.markStale();
            when(ledgerService.loadLedger()).thenReturn(Mono.error(new IllegalStateException("connection refused")));

            StepVerifier.create(service.refresh("test"))
                .expectErrorMatches(e -> e instanceof RecomputeException re
                    && re.getKind() == RecomputeException.Kind.LEDGER_UNAVAILABLE)
                .verify(TIMEOUT);

            assertSame(baseline, cache.current().orElseThrow());
            assertEquals(DerivedState.STALE, cache.state());
            assertFalse(service.isRunning());
        }

        @Test
        @DisplayName("a reducer throwing → COMPUTATION_FAILED")
        void computationFailed() {
            NarrativeGenerator broken = mock(NarrativeGenerator.class);
            when(broken.calibrationRecommendations(any())).thenThrow(new IllegalStateException("boom"));
            RecomputeService failing = service(broken);
            IntelligenceSnapshot baseline = installBaseline(service());

            StepVerifier.create(failing.refresh("test"))
                .expectErrorMatches(e -> e instanceof RecomputeException re
                    && re.getKind() == RecomputeException.Kind.COMPUTATION_FAILED)
                .verify(TIMEOUT);

            assertSame(baseline, cache.current().orElseThrow());
        }

        @Test
        @DisplayName("abort cancels the run with ABORTED and installs nothing")
        void abort() {
            RecomputeService service = service();
            IntelligenceSnapshot baseline = installBaseline(service);
            when(ledgerService.loadLedger()).thenReturn(Sinks.<List<TradeOutcome>>one().asMono());

            StepVerifier.create(service.refresh("test"))
                .then(() -> assertTrue(service.abort()))
                .expectErrorMatches(e -> e instanceof RecomputeException re
                    && re.getKind() == RecomputeException.Kind.ABORTED)
                .verify(TIMEOUT);

            assertSame(baseline, cache.current().orElseThrow());
            assertFalse(service.isRunning());
            assertFalse(service.abort());
        }

        @Test
        @DisplayName("abort after the reducers finish but before the swap installs nothing")
        void abortBeforeSwap() {
            AtomicBoolean aborted = new AtomicBoolean();
            RecomputeService service = new RecomputeService(ledgerService, overrideService, cache,
                    new RuleBasedNarrativeGenerator(), new LedgerSettings(0.1, 20), CalibrationSettings.DEFAULTS,
                    WeightSettings.DEFAULTS, IndexSettings.DEFAULTS, HealthThresholds.DEFAULTS) {
                @Override
                Mono<IntelligenceSnapshot> compute(long version, List<TradeOutcome> rows, Map<String, Double> overrides) {
                    return super.compute(version, rows, overrides).doOnNext(c -> aborted.set(abort()));
                }
            };
            IntelligenceSnapshot baseline = installBaseline(service());
            cache.markStale();

            StepVerifier.create(service.refresh("test"))
                .expectErrorMatches(e -> e instanceof RecomputeException re
                    && re.getKind() == RecomputeException.Kind.ABORTED)
                .verify(TIMEOUT);

            assertTrue(aborted.get());
            assertSame(baseline, cache.current().orElseThrow());
            assertEquals(DerivedState.STALE, cache.state());
            assertFalse(service.isRunning());
        }
    }

    // ── abort racing the swap ────────────────────────────────────────────────

    @Test
    @DisplayName("abort arriving while the snapshot is being installed is refused and the run completes")
    void abortDuringSwapRefused() {
        when(ledgerService.loadLedger()).thenReturn(Mono.just(ledger()));
        overrideService = spy(overrideService);
        RecomputeService service = service();
        AtomicReference<Boolean> abortResult = new AtomicReference<>();
        doAnswer(inv -> {
            abortResult.compareAndSet(null, service.abort());
            return inv.callRealMethod();
        }).when(overrideService).applyTo(any());
        cache.markStale();

        StepVerifier.create(service.refresh("test"))
            .assertNext(r -> assertEquals("COMPLETED", r.status()))
            .expectComplete()
            .verify(TIMEOUT);

        assertFalse(abortResult.get());
        assertEquals(DerivedState.FRESH, cache.state());
        assertFalse(service.isRunning());
    }
}
