package com.tradeintel.intelligence.service;

import com.tradeintel.common.ledger.LedgerSanitizer;
import com.tradeintel.common.model.TradeOutcome;
import com.tradeintel.common.snapshot.SnapshotCache;
import com.tradeintel.intelligence.config.LedgerSettings;
import com.tradeintel.intelligence.dto.RecordOutcomeRequest;
import com.tradeintel.intelligence.repository.TradeOutcomeRepository;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;
import reactor.core.publisher.Flux;
import reactor.core.publisher.Mono;

import java.util.List;
import java.util.concurrent.atomic.AtomicReference;

/**
 * Read access to the outcome ledger plus the one write path this service offers.
 *
 * <p>Every accepted write, and every externally made change spotted by
 * {@link #detectExternalWrites()}, bumps the ledger version and so marks all derived
 * tables stale.
 */
@Service
public class LedgerService {

    private static final Logger log = LoggerFactory.getLogger(LedgerService.class);

    /** Row count and highest id; any append changes at least one of them. */
    record LedgerFingerprint(long rowCount, long maxId) {}

    private final TradeOutcomeRepository repository;
    private final OutcomeMapper mapper;
    private final SnapshotCache cache;
    private final LedgerSettings settings;
    private final AtomicReference<LedgerFingerprint> lastSeen = new AtomicReference<>();

    public LedgerService(TradeOutcomeRepository repository, OutcomeMapper mapper,
                         SnapshotCache cache, LedgerSettings settings) {
        this.repository = repository;
        this.mapper     = mapper;
        this.cache      = cache;
        this.settings   = settings;
    }

    /** Whole ledger, in id order. Validation happens in the recompute pipeline. */
    public Mono<List<TradeOutcome>> loadLedger() {
        return repository.findAllByOrderByIdAsc()
            .map(mapper::toDomain)
            .collectList()
            .doOnSuccess(rows -> log.debug("Ledger loaded. rows={}", rows.size()));
    }

    public Mono<TradeOutcome> record(RecordOutcomeRequest request) {
        return Mono.fromCallable(() -> {
                TradeOutcome outcome = mapper.fromRequest(request);
                LedgerSanitizer.requireValid(outcome, settings.breakevenBand());
                return mapper.toEntity(outcome, request.catalyst());
            })
            .flatMap(repository::save)
            .map(mapper::toDomain)
            .flatMap(saved -> {
                long version = cache.markStale();
                log.info("Outcome recorded. id={} symbol={} resolution={} return={}% ledgerVersion={}",
                         saved.id(), saved.symbol(), saved.resolution(), saved.returnPercent(), version);
                return fingerprint()
                    .doOnNext(lastSeen::set)
                    .onErrorResume(e -> {
                        log.warn("Ledger fingerprint refresh failed (non-fatal). id={}", saved.id(), e);
                        return Mono.empty();
                    })
                    .thenReturn(saved);
            })
            .doOnError(e -> log.warn("Outcome rejected. symbol={} reason={}", request.symbol(), e.getMessage()));
    }

    public Flux<TradeOutcome> recent(String symbol, int limit) {
        int effective = limit > 0 ? limit : settings.recentLimit();
        return repository.findRecentBySymbol(symbol, effective).map(mapper::toDomain);
    }

    /**
     * Compares the ledger fingerprint with the last one seen and marks everything stale when it
     * moved. The first observation only records a baseline.
     *
     * @return true when a change was detected
     */
    public Mono<Boolean> detectExternalWrites() {
        return fingerprint().map(current -> {
            LedgerFingerprint previous = lastSeen.getAndSet(current);
            if (previous == null || previous.equals(current)) {
                return false;
            }
            long version = cache.markStale();
            log.info("External ledger write detected. rows={}->{} maxId={}->{} ledgerVersion={}",
                     previous.rowCount(), current.rowCount(), previous.maxId(), current.maxId(), version);
            return true;
        });
    }

    private Mono<LedgerFingerprint> fingerprint() {
        return Mono.zip(repository.count(), repository.findMaxId())
            .map(t -> new LedgerFingerprint(t.getT1(), t.getT2()));
    }
}
