package com.airouter.provider;

import java.time.Duration;

/**
 * Classified failure of a single provider call. Never leaves the routing loop.
 */
public class ProviderException extends RuntimeException {

    private final ProviderErrorType type;
    private final Duration retryAfter;

    public ProviderException(ProviderErrorType type, String message, Duration retryAfter, Throwable cause) {
        super(message, cause);
        this.type = type;
        this.retryAfter = retryAfter;
    }

    public ProviderException(ProviderErrorType type, String message, Throwable cause) {
        this(type, message, null, cause);
    }

    public ProviderException(ProviderErrorType type, String message) {
        this(type, message, null, null);
    }

    public ProviderErrorType getType() {
        return type;
    }

    /**
     * Throttling hint sent by the provider, or null.
     */
    public Duration getRetryAfter() {
        return retryAfter;
    }
}
