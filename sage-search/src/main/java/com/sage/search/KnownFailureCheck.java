package com.sage.search;

/**
 * Answers whether a URL is a recorded permanent access failure (backed by the memory store).
 */
@FunctionalInterface
public interface KnownFailureCheck {

    KnownFailureCheck NONE = url -> false;

    boolean isKnownFailure(String url);
}
