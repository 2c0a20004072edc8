package com.tradeintel.common.exception;

/** A ledger write was rejected because the outcome is internally inconsistent. */
public class InvalidOutcomeException extends AnalyticsException {

    public InvalidOutcomeException(String message) {
        super("MALFORMED_RECORD", message);
    }
}
