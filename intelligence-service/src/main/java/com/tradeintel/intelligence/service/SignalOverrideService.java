package com.tradeintel.intelligence.service;

import com.tradeintel.common.model.SignalWeight;
import com.tradeintel.common.snapshot.IntelligenceSnapshot;
import com.tradeintel.common.snapshot.SnapshotCache;
import com.tradeintel.common.weights.SignalWeightEngine;
import com.tradeintel.common.weights.WeightSettings;
import com.tradeintel.intelligence.model.SignalWeightOverride;
import com.tradeintel.intelligence.repository.SignalWeightOverrideRepository;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;
import reactor.core.publisher.Mono;

import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.concurrent.atomic.AtomicReference;

/**
 * Operator-managed signal weight overrides.
 *
 * <p>Overrides are persisted and mirrored in memory. Setting or removing one re-decides the
 * signal weight table of the installed snapshot in place; the ledger version is not touched,
 * since no ledger row changed.
 */
@Service
public class SignalOverrideService {

    private static final Logger log = LoggerFactory.getLogger(SignalOverrideService.class);

    private final SignalWeightOverrideRepository repository;
    private final SnapshotCache cache;
    private final WeightSettings settings;

    // null until first load from the database
    private final AtomicReference<Map<String, Double>> overrides = new AtomicReference<>();

    public SignalOverrideService(SignalWeightOverrideRepository repository,
                                 SnapshotCache cache,
                                 WeightSettings settings) {
        this.repository = repository;
        this.cache      = cache;
        this.settings   = settings;
    }

    /** Loads persisted overrides once; later calls return the in-memory view. */
    public Mono<Map<String, Double>> loadOverrides() {
        Map<String, Double> loaded = overrides.get();
        if (loaded != null) {
            return Mono.just(loaded);
        }
        return repository.findAll()
            .collectMap(SignalWeightOverride::getSignalName, SignalWeightOverride::getOverrideWeight)
            .map(fromDb -> {
                Map<String, Double> immutable = Map.copyOf(fromDb);
                overrides.compareAndSet(null, immutable);
                log.info("Signal weight overrides loaded. count={}", immutable.size());
                return overrides.get();
            });
    }

    public Map<String, Double> currentOverrides() {
        Map<String, Double> loaded = overrides.get();
        return loaded == null ? Map.of() : loaded;
    }

    public Mono<SignalWeight> setOverride(String signal, double weight, String reason) {
        return Mono.fromRunnable(() -> SignalWeightEngine.validateOverride(signal, weight))
            .then(loadOverrides())
            .flatMap(ignored -> repository.upsertOverride(signal.trim(), weight, reason))
            .then(Mono.fromCallable(() -> {
                String name = signal.trim();
                overrides.updateAndGet(m -> {
                    Map<String, Double> next = new HashMap<>(m == null ? Map.of() : m);
                    next.put(name, weight);
                    return Map.copyOf(next);
                });
                cache.update(this::applyTo);
                log.info("Signal weight override set. signal={} weight={} reason={}", name, weight, reason);
                return name;
            }))
            .map(name -> cache.current()
                .flatMap(s -> s.signalWeights().stream().filter(w -> w.signal().equals(name)).findFirst())
                // no snapshot yet: report the override against an untested row
                .orElseGet(() -> SignalWeightEngine.applyOverrides(List.of(), Map.of(name, weight)).get(0)));
    }

    /** @return true when an override existed and was removed */
    public Mono<Boolean> removeOverride(String signal) {
        String name = signal == null ? "" : signal.trim();
        return loadOverrides()
            .then(repository.existsById(name))
            .flatMap(exists -> {
                if (!exists) {
                    return Mono.just(false);
                }
                return repository.deleteById(name).then(Mono.fromCallable(() -> {
                    overrides.updateAndGet(m -> {
                        Map<String, Double> next = new HashMap<>(m == null ? Map.of() : m);
                        next.remove(name);
                        return Map.copyOf(next);
                    });
                    cache.update(this::applyTo);
                    log.info("Signal weight override removed. signal={}", name);
                    return true;
                }));
            });
    }

    /** Re-decides every row of the snapshot's weight table against the current overrides. */
    public IntelligenceSnapshot applyTo(IntelligenceSnapshot snapshot) {
        List<SignalWeight> weights = SignalWeightEngine.applyOverrides(snapshot.signalWeights(), currentOverrides());
        return snapshot.withSignalWeights(weights, SignalWeightEngine.summarize(weights, settings));
    }
}
