package com.sage.model.error;

import java.time.Duration;

/**
 * Provider answered "too many requests". Retryable; {@link #getRetryAfter()} is the provider's hint, if any.
 */
public final class RateLimitException extends NetworkException {

    private final Duration retryAfter;

    public RateLimitException(String provider, Duration retryAfter) {
        super(provider, "Rate limited by " + provider + (retryAfter != null ? " (retry after " + retryAfter.toMillis() + " ms)" : ""));
        this.retryAfter = retryAfter;
    }

    /** Null when the provider gave no hint. */
    public Duration getRetryAfter() {
        return retryAfter;
    }
}
