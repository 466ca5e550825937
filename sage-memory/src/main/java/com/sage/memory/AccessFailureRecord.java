package com.sage.memory;

/**
 * A URL that refused access. {@code retryCount} counts how many times the failure was recorded.
 */
public record AccessFailureRecord(String url, String source, String errorType, String message,
                                  long firstSeenAt, long lastSeenAt, int retryCount) {

    AccessFailureRecord repeated(String newMessage, long now) {
        return new AccessFailureRecord(url, source, errorType, newMessage != null ? newMessage : message,
                firstSeenAt, now, retryCount + 1);
    }
}
