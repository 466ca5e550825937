package com.sage.search;

import com.sage.model.SourceResult;

import java.util.List;

/**
 * Detailed outcome of one fan-out: merged results plus which providers came back empty or timed out.
 *
 * @param citations every URL returned, before de-duplication against known failures
 */
public record CollectionReport(
        List<SourceResult> results,
        List<String> providersQueried,
        List<String> providersEmpty,
        List<String> providersTimedOut,
        List<String> citations,
        int duplicatesDropped,
        int knownFailuresSkipped
) {
    public CollectionReport {
        results = List.copyOf(results);
        providersQueried = List.copyOf(providersQueried);
        providersEmpty = List.copyOf(providersEmpty);
        providersTimedOut = List.copyOf(providersTimedOut);
        citations = List.copyOf(citations);
    }

    public boolean isExhausted() {
        return providersEmpty.size() == providersQueried.size();
    }
}
