package com.tradeintel.intelligence.repository;

import com.tradeintel.intelligence.model.SignalWeightOverride;
import org.springframework.data.r2dbc.repository.Modifying;
import org.springframework.data.r2dbc.repository.Query;
import org.springframework.data.repository.reactive.ReactiveCrudRepository;
import org.springframework.stereotype.Repository;
import reactor.core.publisher.Mono;

@Repository
public interface SignalWeightOverrideRepository
        extends ReactiveCrudRepository<SignalWeightOverride, String> {

    /**
     * Inserts or replaces the override for {@code signalName}.
     *
     * @param signalName natural PK
     * @param weight     validated positive, finite weight
     * @param reason     operator note (nullable)
     */
    @Modifying
    @Query("""
        INSERT INTO signal_weight_overrides (signal_name, override_weight, reason, updated_at)
        VALUES (:signalName, :weight, :reason, NOW())
        ON CONFLICT (signal_name) DO UPDATE SET
            override_weight = :weight,
            reason          = :reason,
            updated_at      = NOW()
        """)
    Mono<Void> upsertOverride(String signalName, double weight, String reason);
}
