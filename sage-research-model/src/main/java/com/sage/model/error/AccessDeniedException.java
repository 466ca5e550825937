package com.sage.model.error;

/**
 * Provider refused access to a URL. Terminal for that URL; recorded permanently so it is skipped later.
 */
public final class AccessDeniedException extends NetworkException {

    private final String url;
    private final int statusCode;

    public AccessDeniedException(String provider, String url, int statusCode) {
        super(provider, "Access denied by " + provider + " for " + url + " (HTTP " + statusCode + ")");
        this.url = url;
        this.statusCode = statusCode;
    }

    public String getUrl() {
        return url;
    }

    public int getStatusCode() {
        return statusCode;
    }
}
