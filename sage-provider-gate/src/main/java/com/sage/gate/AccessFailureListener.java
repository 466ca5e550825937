package com.sage.gate;

/**
 * Receives terminal access failures (e.g. HTTP 403 for a URL) so they can be recorded permanently.
 */
@FunctionalInterface
public interface AccessFailureListener {

    AccessFailureListener NONE = (url, provider, errorType, message) -> { };

    void onAccessFailure(String url, String provider, String errorType, String message);
}
