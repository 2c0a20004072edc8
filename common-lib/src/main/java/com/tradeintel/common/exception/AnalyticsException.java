package com.tradeintel.common.exception;

/** Base of every failure raised by the analytics pipeline. */
public class AnalyticsException extends RuntimeException {

    private final String errorKind;

    public AnalyticsException(String errorKind, String message) {
        super(message);
        this.errorKind = errorKind;
    }

    public AnalyticsException(String errorKind, String message, Throwable cause) {
        super(message, cause);
        this.errorKind = errorKind;
    }

    public String getErrorKind() {
        return errorKind;
    }
}
