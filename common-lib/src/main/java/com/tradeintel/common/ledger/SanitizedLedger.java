package com.tradeintel.common.ledger;

import com.tradeintel.common.model.TradeOutcome;

import java.util.List;

/**
 * Ledger rows that passed validation, in canonical order, plus the rows that did not.
 */
public record SanitizedLedger(List<TradeOutcome> outcomes, List<RejectedOutcome> rejected) {

    public List<TradeOutcome> closed() {
        return outcomes.stream().filter(TradeOutcome::isClosed).toList();
    }
}
