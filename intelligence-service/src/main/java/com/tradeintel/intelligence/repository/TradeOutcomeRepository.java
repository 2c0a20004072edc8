package com.tradeintel.intelligence.repository;

import com.tradeintel.intelligence.model.TradeOutcomeRecord;
import org.springframework.data.r2dbc.repository.Query;
import org.springframework.data.repository.reactive.ReactiveCrudRepository;
import org.springframework.stereotype.Repository;
import reactor.core.publisher.Flux;
import reactor.core.publisher.Mono;

@Repository
public interface TradeOutcomeRepository extends ReactiveCrudRepository<TradeOutcomeRecord, Long> {

    Flux<TradeOutcomeRecord> findAllByOrderByIdAsc();

    @Query("""
        SELECT * FROM trade_outcomes
        WHERE UPPER(symbol) = UPPER(:symbol)
        ORDER BY COALESCE(closed_at, opened_at) DESC NULLS LAST, id DESC
        LIMIT :limit
        """)
    Flux<TradeOutcomeRecord> findRecentBySymbol(String symbol, int limit);

    /** Highest ledger id, 0 for an empty ledger. Paired with {@code count()} as a change fingerprint. */
    @Query("SELECT COALESCE(MAX(id), 0) FROM trade_outcomes")
    Mono<Long> findMaxId();
}
