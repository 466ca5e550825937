package com.sage.model.error;

/** Provider call timed out. Retryable up to the retry budget. */
public final class ProviderTimeoutException extends NetworkException {

    public ProviderTimeoutException(String provider, String message, Throwable cause) {
        super(provider, message, cause);
    }

    public ProviderTimeoutException(String provider, String message) {
        super(provider, message);
    }
}
