package com.sage.model.error;

/**
 * Failure talking to an external provider. Transient subclasses are retried inside the provider gate
 * and never surface beyond it.
 */
public class NetworkException extends ResearchToolException {

    private final String provider;

    public NetworkException(String provider, String message) {
        super(message);
        this.provider = provider;
    }

    public NetworkException(String provider, String message, Throwable cause) {
        super(message, cause);
        this.provider = provider;
    }

    public String getProvider() {
        return provider;
    }
}
