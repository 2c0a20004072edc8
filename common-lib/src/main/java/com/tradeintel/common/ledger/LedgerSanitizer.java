package com.tradeintel.common.ledger;

import com.tradeintel.common.exception.InvalidOutcomeException;
import com.tradeintel.common.model.OutcomeResolution;
import com.tradeintel.common.model.TradeOutcome;

import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import java.util.Optional;

/**
 * Validates ledger rows before any reduction runs.
 *
 * <p>A row is rejected outright only when no aggregation can use it: missing symbol or
 * resolution, a closed row with no (or a non-finite) realized return, a resolution that
 * contradicts the return outside the breakeven band. Missing optional fields (engine,
 * catalyst, confidence, direction) and out-of-range confidences are left for each
 * aggregation to skip locally. The write path is stricter, see {@link #requireValid}.
 */
public final class LedgerSanitizer {

    private LedgerSanitizer() {}

    public static SanitizedLedger sanitize(List<TradeOutcome> rows, double breakevenBand) {
        List<TradeOutcome> valid = new ArrayList<>(rows.size());
        List<RejectedOutcome> rejected = new ArrayList<>();
        for (TradeOutcome row : rows) {
            Optional<String> problem = validate(row, breakevenBand);
            if (problem.isPresent()) {
                rejected.add(new RejectedOutcome(row.id(), row.symbol(), problem.get()));
            } else {
                valid.add(row);
            }
        }
        valid.sort(TradeOutcome.CHRONOLOGICAL);
        return new SanitizedLedger(List.copyOf(valid), List.copyOf(rejected));
    }

    /** Write-time check: throws instead of collecting, and also rejects a confidence outside [0, 100]. */
    public static void requireValid(TradeOutcome row, double breakevenBand) {
        validate(row, breakevenBand).ifPresent(reason -> {
            throw new InvalidOutcomeException(reason);
        });
        if (row.confidenceScore() != null && !row.hasUsableConfidence()) {
            throw new InvalidOutcomeException("confidence " + row.confidenceScore() + " outside [0, 100]");
        }
    }

    /** @return the reason the row is malformed, or empty when it is usable */
    public static Optional<String> validate(TradeOutcome row, double breakevenBand) {
        if (row.symbol() == null || row.symbol().isBlank()) {
            return Optional.of("missing symbol");
        }
        if (row.resolution() == null) {
            return Optional.of("missing resolution");
        }
        Double ret = row.returnPercent();
        if (ret != null && !Double.isFinite(ret)) {
            return Optional.of("non-finite return " + ret);
        }
        if (!row.isClosed()) {
            return Optional.empty();
        }
        if (ret == null) {
            return Optional.of("resolution " + row.resolution() + " without a realized return");
        }
        OutcomeResolution expected = OutcomeResolution.classify(ret, breakevenBand);
        if (expected != row.resolution()) {
            return Optional.of(String.format(Locale.ROOT,
                "resolution %s inconsistent with return %.4f%% (expected %s)", row.resolution(), ret, expected));
        }
        return Optional.empty();
    }
}
