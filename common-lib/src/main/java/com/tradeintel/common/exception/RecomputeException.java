package com.tradeintel.common.exception;

/**
 * A full refresh could not complete. The previously installed snapshot is left untouched.
 */
public class RecomputeException extends AnalyticsException {

    public enum Kind {
        /** The ledger could not be read. */
        LEDGER_UNAVAILABLE,
        /** A reducer threw while building the new snapshot. */
        COMPUTATION_FAILED,
        /** The refresh was cancelled by an operator before it finished. */
        ABORTED
    }

    private final Kind kind;

    public RecomputeException(Kind kind, String message) {
        super(kind.name(), message);
        this.kind = kind;
    }

    public RecomputeException(Kind kind, String message, Throwable cause) {
        super(kind.name(), message, cause);
        this.kind = kind;
    }

    public Kind getKind() {
        return kind;
    }
}
