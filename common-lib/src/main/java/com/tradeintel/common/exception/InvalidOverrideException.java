package com.tradeintel.common.exception;

/** A manual signal-weight override was rejected at write time. Overrides are never clamped. */
public class InvalidOverrideException extends AnalyticsException {

    private final String signal;

    public InvalidOverrideException(String signal, String message) {
        super("OVERRIDE_CONFLICT", "[" + signal + "] " + message);
        this.signal = signal;
    }

    public String getSignal() {
        return signal;
    }
}
