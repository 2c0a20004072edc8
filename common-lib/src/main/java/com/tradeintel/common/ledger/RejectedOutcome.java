package com.tradeintel.common.ledger;

/** A ledger row dropped before aggregation, with the reason it was dropped. */
public record RejectedOutcome(Long id, String symbol, String reason) {}
