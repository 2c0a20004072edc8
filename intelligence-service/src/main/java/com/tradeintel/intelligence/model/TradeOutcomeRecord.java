package com.tradeintel.intelligence.model;

import lombok.Data;
import lombok.NoArgsConstructor;
import org.springframework.data.annotation.Id;
import org.springframework.data.relational.core.mapping.Table;

import java.time.Instant;

/**
 * Outcome ledger row. Append-only: rows are inserted once resolved (or as open ideas) and
 * never updated by this service.
 *
 * <p>{@code signals} holds a JSON array of signal tags. {@code catalystText} keeps the
 * free-text catalyst description when the upstream producer did not assign a catalyst type.
 */
@Data
@NoArgsConstructor
@Table("trade_outcomes")
public class TradeOutcomeRecord {

    @Id
    private Long id;

    private String symbol;

    private String engine;

    private String assetType;

    private String direction;

    private String signals;

    // Nullable: producers that do not score confidence leave it empty
    private Double confidenceScore;

    private String catalystType;

    private String catalystText;

    // Null while the idea is still open
    private Double returnPercent;

    private Double realizedPnl;

    private String resolution;

    private Instant openedAt;

    private Instant closedAt;

    private Instant recordedAt;
}
